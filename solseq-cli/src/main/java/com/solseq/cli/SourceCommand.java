package com.solseq.cli;

import com.solseq.core.ContractDiagramEngine;
import com.solseq.core.extractor.source.SourceBuffer;
import com.solseq.core.generator.GeneratedDiagram;
import com.solseq.core.generator.GeneratorConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command to generate a diagram directly from Solidity source files, without a compiler.
 *
 * <p>All files are read as one input set, so calls between contracts in different
 * files resolve.
 */
@Command(
    name = "source",
    description = "Generate a sequence diagram from Solidity source files",
    mixinStandardHelpOptions = true
)
public class SourceCommand extends AbstractDiagramCommand {

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Solidity source files")
    private List<Path> sourceFiles;

    @Option(names = {"-o", "--output"}, description = "Output file (prints to stdout if omitted)")
    private Path output;

    @Override
    protected GeneratedDiagram generate(ContractDiagramEngine engine, GeneratorConfig config) throws IOException {
        List<SourceBuffer> buffers = new ArrayList<>();
        for (Path file : sourceFiles) {
            log.debug("Reading source file: {}", file);
            buffers.add(new SourceBuffer(file.toString(), Files.readString(file, StandardCharsets.UTF_8)));
        }
        log.info("Read {} source file(s)", buffers.size());
        return engine.generateFromSources(buffers, config);
    }

    @Override
    protected Path outputFile() {
        return output;
    }
}

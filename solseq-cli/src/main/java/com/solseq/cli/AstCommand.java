package com.solseq.cli;

import com.solseq.core.ContractDiagramEngine;
import com.solseq.core.generator.GeneratedDiagram;
import com.solseq.core.generator.GeneratorConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command to generate a diagram from a compiler AST document.
 *
 * <p>Accepts standard-JSON compiler output, combined-JSON output, a bare
 * {@code SourceUnit} or an array of them.
 */
@Command(
    name = "ast",
    description = "Generate a sequence diagram from a Solidity AST JSON file",
    mixinStandardHelpOptions = true
)
public class AstCommand extends AbstractDiagramCommand {

    @Parameters(index = "0", paramLabel = "AST_FILE", description = "AST JSON file")
    private Path astFile;

    @Parameters(index = "1", arity = "0..1", paramLabel = "OUTPUT",
        description = "Output file (prints to stdout if omitted)")
    private Path output;

    @Override
    protected GeneratedDiagram generate(ContractDiagramEngine engine, GeneratorConfig config) throws IOException {
        log.info("Reading AST document: {}", astFile);
        String json = Files.readString(astFile, StandardCharsets.UTF_8);
        return engine.generateFromAst(json, config);
    }

    @Override
    protected Path outputFile() {
        return output;
    }
}

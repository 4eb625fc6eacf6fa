package com.solseq.cli;

import com.solseq.SolSeqCLI;
import com.solseq.cli.renderer.ConsoleRenderer;
import com.solseq.cli.renderer.FileSystemRenderer;
import com.solseq.cli.renderer.OutputRenderer;
import com.solseq.core.ContractDiagramEngine;
import com.solseq.core.ast.AstFormatException;
import com.solseq.core.config.ConfigLoader;
import com.solseq.core.config.ProjectConfig;
import com.solseq.core.generator.GeneratedDiagram;
import com.solseq.core.generator.GeneratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Shared options and flow of the diagram commands: load configuration, generate, render.
 *
 * <p>Command-line options override {@code solseq.yaml}. Without {@code --config} the file
 * is looked up in the working directory and silently skipped when absent.
 */
public abstract class AbstractDiagramCommand implements Callable<Integer> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @ParentCommand
    private SolSeqCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-l", "--light-colors"}, description = "Use the lighter color palette")
    private boolean lightColors;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ./solseq.yaml if present)")
    private Path configFile;

    @Option(names = "--title", description = "Diagram title")
    private String title;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }

        PrintWriter err = spec.commandLine().getErr();
        try {
            ProjectConfig projectConfig = loadConfig();
            GeneratorConfig generatorConfig = effectiveConfig(projectConfig);
            GeneratedDiagram diagram = generate(new ContractDiagramEngine(), generatorConfig);
            renderer(projectConfig).render(diagram);
            return 0;
        } catch (IOException e) {
            log.debug("Input could not be read", e);
            err.println("Error: failed to read input: " + e.getMessage());
            return 1;
        } catch (AstFormatException | IllegalStateException e) {
            log.debug("Diagram generation failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Generates the diagram from this command's input.
     *
     * @param engine diagram engine
     * @param config effective generator configuration
     * @return generated diagram
     * @throws IOException if an input file cannot be read
     */
    protected abstract GeneratedDiagram generate(ContractDiagramEngine engine, GeneratorConfig config)
        throws IOException;

    /**
     * Returns the output file given on the command line, or null.
     *
     * @return output file or null
     */
    protected abstract Path outputFile();

    private ProjectConfig loadConfig() {
        if (configFile != null) {
            return ConfigLoader.load(configFile);
        }
        Path defaultFile = Path.of(ConfigLoader.DEFAULT_FILE_NAME);
        return Files.exists(defaultFile) ? ConfigLoader.load(defaultFile) : ProjectConfig.defaults();
    }

    private GeneratorConfig effectiveConfig(ProjectConfig projectConfig) {
        GeneratorConfig fromFile = projectConfig.toGeneratorConfig();
        return new GeneratorConfig(
            lightColors || fromFile.lightTheme(),
            title != null ? title : fromFile.title());
    }

    private OutputRenderer renderer(ProjectConfig projectConfig) {
        PrintWriter out = spec.commandLine().getOut();
        Path target = outputFile();
        if (target == null && projectConfig.output().file() != null) {
            target = Path.of(projectConfig.output().file());
        }
        return target == null ? new ConsoleRenderer(out) : new FileSystemRenderer(target, out);
    }
}

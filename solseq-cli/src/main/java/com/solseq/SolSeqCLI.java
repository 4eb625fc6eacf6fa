package com.solseq;

import com.solseq.cli.AstCommand;
import com.solseq.cli.SourceCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for SolSeq.
 *
 * <p>SolSeq turns Solidity contracts into Mermaid sequence diagrams, either from a
 * compiler AST document or directly from source files.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code ast} - Generate a diagram from an AST JSON document</li>
 *   <li>{@code source} - Generate a diagram from Solidity source files</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Print a diagram for a compiler output file
 * solseq ast build/ast.json
 *
 * # Write a light-themed diagram to a file
 * solseq ast -l build/ast.json docs/sequence.md
 *
 * # Read Solidity sources directly
 * solseq -v source contracts/Vault.sol contracts/Token.sol -o docs/sequence.md
 * }</pre>
 */
@Command(
    name = "solseq",
    mixinStandardHelpOptions = true,
    version = "SolSeq 1.0.0-SNAPSHOT",
    description = "Generate Mermaid sequence diagrams from Solidity smart contracts",
    subcommands = {
        AstCommand.class,
        SourceCommand.class
    }
)
public class SolSeqCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SolSeqCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("SolSeq - Solidity Sequence Diagram Generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'solseq --help' to see available commands");
        System.out.println("Use 'solseq <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     *
     * <p>Subcommands call this before doing any work, since picocli only runs the
     * root command when no subcommand is given.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SolSeqCLI()).execute(args);
        System.exit(exitCode);
    }
}

package com.solseq.cli.renderer;

import com.solseq.core.generator.GeneratedDiagram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Objects;

/**
 * Renderer that prints the diagram document to standard output.
 *
 * <p>Only the document itself is written, so the output can be redirected straight into
 * a Markdown file. Log output goes to standard error.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private final PrintWriter out;

    public ConsoleRenderer() {
        this(new PrintWriter(System.out, true));
    }

    public ConsoleRenderer(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedDiagram diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        logger.debug("Printing diagram {} ({} chars)", diagram.name(), diagram.content().length());
        out.print(diagram.content());
        out.flush();
        if (out.checkError()) {
            throw new IllegalStateException("Failed to write diagram to standard output");
        }
    }
}

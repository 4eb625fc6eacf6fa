package com.solseq.cli.renderer;

import com.solseq.core.generator.GeneratedDiagram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Renderer that writes the diagram to a file.
 *
 * <p>Creates missing parent directories and overwrites an existing file. A single
 * confirmation line is printed once the file is written.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * OutputRenderer renderer = new FileSystemRenderer(Path.of("docs/sequence.md"));
 * renderer.render(diagram);
 * // Creates: docs/sequence.md
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    private final Path target;
    private final PrintWriter out;

    public FileSystemRenderer(Path target) {
        this(target, new PrintWriter(System.out, true));
    }

    public FileSystemRenderer(Path target, PrintWriter out) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedDiagram diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        logger.debug("Writing diagram {} to: {}", diagram.name(), target);

        try {
            Path parentDir = target.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(target, diagram.content(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write diagram: " + target, e);
        }

        logger.info("Wrote file: {} ({} bytes)", target, diagram.content().length());
        out.println("Sequence diagram generated successfully: " + target);
        out.flush();
    }
}

package com.solseq.cli.renderer;

import com.solseq.core.generator.GeneratedDiagram;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private StringWriter confirmation;
    private GeneratedDiagram diagram;

    @BeforeEach
    void setUp() {
        confirmation = new StringWriter();
        diagram = new GeneratedDiagram("contract-interactions", "```mermaid\nsequenceDiagram\n```\n", "md");
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(new FileSystemRenderer(tempDir.resolve("x.md")).getId()).isEqualTo("filesystem");
    }

    @Test
    void render_createsParentDirectories() throws IOException {
        Path target = tempDir.resolve("docs/architecture/sequence.md");

        new FileSystemRenderer(target, new PrintWriter(confirmation)).render(diagram);

        assertThat(target).exists();
        assertThat(Files.readString(target)).isEqualTo(diagram.content());
        assertThat(confirmation.toString()).contains("Sequence diagram generated successfully: " + target);
    }

    @Test
    void render_existingFile_isOverwritten() throws IOException {
        Path target = tempDir.resolve("sequence.md");
        Files.writeString(target, "old content that is longer than the new one");

        new FileSystemRenderer(target, new PrintWriter(confirmation)).render(diagram);

        assertThat(Files.readString(target)).isEqualTo(diagram.content());
    }

    @Test
    void render_targetIsDirectory_throwsIllegalStateException() throws IOException {
        Path target = Files.createDirectories(tempDir.resolve("taken"));

        FileSystemRenderer renderer = new FileSystemRenderer(target, new PrintWriter(confirmation));

        assertThatThrownBy(() -> renderer.render(diagram))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to write diagram");
        assertThat(confirmation.toString()).isEmpty();
    }

    @Test
    void constructor_nullTarget_throwsException() {
        assertThatThrownBy(() -> new FileSystemRenderer(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("target");
    }
}

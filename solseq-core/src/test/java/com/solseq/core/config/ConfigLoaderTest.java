package com.solseq.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            diagram:
              lightTheme: true
              title: "Vault Interactions"

            output:
              file: "./docs/vault-sequence.md"
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.diagram().lightTheme()).isTrue();
        assertThat(config.diagram().title()).isEqualTo("Vault Interactions");
        assertThat(config.output().file()).isEqualTo("./docs/vault-sequence.md");
    }

    @Test
    void load_partialYaml_fillsMissingSections() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            diagram:
              title: "Only a title"
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.diagram().lightTheme()).isFalse();
        assertThat(config.diagram().title()).isEqualTo("Only a title");
        assertThat(config.output()).isNotNull();
        assertThat(config.output().file()).isNull();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            project:
              name: "ignored"
            diagram:
              lightTheme: true
              direction: LR
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.diagram().lightTheme()).isTrue();
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        Path configFile = tempDir.resolve("nonexistent.yaml");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            diagram:
              lightTheme: [unclosed
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }
}

package com.solseq.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.solseq.core.generator.GeneratorConfig;

/**
 * Root configuration for SolSeq runs.
 *
 * <p>Loaded from {@code solseq.yaml}. Every setting is optional; command-line options
 * override the file.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * diagram:
 *   lightTheme: true
 *   title: "Vault Interactions"
 *
 * output:
 *   file: "./docs/vault-sequence.md"
 * }</pre>
 *
 * @param diagram diagram presentation settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("diagram") DiagramSettings diagram,
    @JsonProperty("output") OutputSettings output
) {
    /**
     * Compact constructor filling in missing sections.
     */
    public ProjectConfig {
        if (diagram == null) {
            diagram = new DiagramSettings(false, null);
        }
        if (output == null) {
            output = new OutputSettings(null);
        }
    }

    /**
     * Creates a default configuration: default palette, default title, output to stdout.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(new DiagramSettings(false, null), new OutputSettings(null));
    }

    /**
     * Converts the diagram settings into a generator configuration.
     *
     * @return generator configuration
     */
    public GeneratorConfig toGeneratorConfig() {
        return new GeneratorConfig(diagram.lightTheme(), diagram.title());
    }

    /**
     * Diagram presentation settings.
     *
     * @param lightTheme whether to use the light palette
     * @param title diagram title, default title when null
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiagramSettings(
        @JsonProperty("lightTheme") boolean lightTheme,
        @JsonProperty("title") String title
    ) {}

    /**
     * Output settings.
     *
     * @param file output file; null writes to stdout
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("file") String file
    ) {}
}

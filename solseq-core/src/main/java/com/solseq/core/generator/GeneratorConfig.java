package com.solseq.core.generator;

/**
 * Configuration for diagram generation.
 *
 * <p>Only presentation is configurable: neither option affects extraction or message order.
 *
 * @param lightTheme whether to embed the {@link ColorPalette#LIGHT} palette instead of {@link ColorPalette#DEFAULT}
 * @param title diagram title line
 */
public record GeneratorConfig(
    boolean lightTheme,
    String title
) {
    public static final String DEFAULT_TITLE = "Smart Contract Interaction Sequence Diagram";

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (title == null || title.isBlank()) {
            title = DEFAULT_TITLE;
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(false, DEFAULT_TITLE);
    }

    /**
     * Returns the palette selected by {@link #lightTheme()}.
     *
     * @return color palette
     */
    public ColorPalette palette() {
        return lightTheme ? ColorPalette.LIGHT : ColorPalette.DEFAULT;
    }
}

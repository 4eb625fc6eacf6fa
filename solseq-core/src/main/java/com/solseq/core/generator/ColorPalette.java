package com.solseq.core.generator;

import java.util.Objects;

/**
 * Fixed set of presentation colors embedded into a diagram.
 *
 * <p>Exactly two presets exist, {@link #DEFAULT} and {@link #LIGHT}.
 *
 * @param primaryColor theme variable {@code primaryColor}
 * @param primaryTextColor theme variable {@code primaryTextColor}
 * @param primaryBorderColor theme variable {@code primaryBorderColor}
 * @param lineColor theme variable {@code lineColor}
 * @param secondaryColor theme variable {@code secondaryColor}
 * @param tertiaryColor theme variable {@code tertiaryColor}
 * @param userSection background of the User Interactions title
 * @param contractSection background of the Contract-to-Contract Interactions title
 * @param eventSection background of the Event Definitions title
 * @param relationshipSection background of the Contract Relationships title
 * @param legendSection background of the legend title
 */
public record ColorPalette(
    String primaryColor,
    String primaryTextColor,
    String primaryBorderColor,
    String lineColor,
    String secondaryColor,
    String tertiaryColor,
    String userSection,
    String contractSection,
    String eventSection,
    String relationshipSection,
    String legendSection
) {
    public static final ColorPalette DEFAULT = new ColorPalette(
        "#f5f5f5",
        "#333",
        "#999",
        "#666",
        "#f0f8ff",
        "#fff5f5",
        "rgb(245, 245, 245)",
        "rgb(240, 248, 255)",
        "rgb(255, 245, 245)",
        "rgb(245, 255, 245)",
        "rgb(240, 240, 255)"
    );

    public static final ColorPalette LIGHT = new ColorPalette(
        "#fafbfc",
        "#444",
        "#e1e4e8",
        "#a0aec0",
        "#f5fbff",
        "#fff8f8",
        "rgb(252, 252, 255)",
        "rgb(248, 252, 255)",
        "rgb(255, 252, 252)",
        "rgb(252, 255, 252)",
        "rgb(248, 252, 255)"
    );

    /**
     * Compact constructor with validation.
     */
    public ColorPalette {
        Objects.requireNonNull(primaryColor, "primaryColor must not be null");
        Objects.requireNonNull(primaryTextColor, "primaryTextColor must not be null");
        Objects.requireNonNull(primaryBorderColor, "primaryBorderColor must not be null");
        Objects.requireNonNull(lineColor, "lineColor must not be null");
        Objects.requireNonNull(secondaryColor, "secondaryColor must not be null");
        Objects.requireNonNull(tertiaryColor, "tertiaryColor must not be null");
        Objects.requireNonNull(userSection, "userSection must not be null");
        Objects.requireNonNull(contractSection, "contractSection must not be null");
        Objects.requireNonNull(eventSection, "eventSection must not be null");
        Objects.requireNonNull(relationshipSection, "relationshipSection must not be null");
        Objects.requireNonNull(legendSection, "legendSection must not be null");
    }
}

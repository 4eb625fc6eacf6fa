package com.solseq.core.generator;

import java.util.Objects;

/**
 * Represents a generated diagram.
 *
 * @param name diagram name
 * @param content complete diagram document
 * @param fileExtension file extension for this content
 */
public record GeneratedDiagram(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }
}

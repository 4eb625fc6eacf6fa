package com.solseq.core.extractor.source;

import java.util.Objects;

/**
 * Raw source text tagged with where it came from.
 *
 * @param sourceId file path or synthetic buffer name, shown as the contract origin
 * @param text source text
 */
public record SourceBuffer(
    String sourceId,
    String text
) {
    /**
     * Compact constructor with validation.
     */
    public SourceBuffer {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}

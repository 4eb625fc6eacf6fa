package com.solseq.core.model;

import java.util.Optional;

/**
 * Solidity visibility specifiers.
 *
 * <p>State variables use {@link #PUBLIC}, {@link #INTERNAL} and {@link #PRIVATE} only.
 */
public enum Visibility {
    PUBLIC,
    EXTERNAL,
    INTERNAL,
    PRIVATE;

    /**
     * Returns whether an externally owned account can call a function with this visibility.
     *
     * @return true for public and external
     */
    public boolean isUserFacing() {
        return this == PUBLIC || this == EXTERNAL;
    }

    /**
     * Parses a visibility keyword.
     *
     * @param keyword keyword such as "external", may be null
     * @return matching visibility, or empty when the keyword is not a visibility
     */
    public static Optional<Visibility> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        return switch (keyword.trim()) {
            case "public" -> Optional.of(PUBLIC);
            case "external" -> Optional.of(EXTERNAL);
            case "internal" -> Optional.of(INTERNAL);
            case "private" -> Optional.of(PRIVATE);
            default -> Optional.empty();
        };
    }
}

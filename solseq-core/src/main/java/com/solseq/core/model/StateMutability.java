package com.solseq.core.model;

import java.util.Optional;

/**
 * State mutability of a function. {@code NONE} is the implicit non-payable default.
 */
public enum StateMutability {
    VIEW,
    PURE,
    PAYABLE,
    NONE;

    /**
     * Returns whether the function is read-only.
     *
     * @return true for view and pure
     */
    public boolean isReadOnly() {
        return this == VIEW || this == PURE;
    }

    /**
     * Parses a mutability keyword. The pre-0.5 {@code constant} keyword maps to {@link #VIEW}.
     *
     * @param keyword keyword such as "view", may be null
     * @return matching mutability, or empty when the keyword is not a mutability
     */
    public static Optional<StateMutability> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        return switch (keyword.trim()) {
            case "view", "constant" -> Optional.of(VIEW);
            case "pure" -> Optional.of(PURE);
            case "payable" -> Optional.of(PAYABLE);
            case "nonpayable" -> Optional.of(NONE);
            default -> Optional.empty();
        };
    }
}

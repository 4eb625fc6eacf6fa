package com.solseq.core.model;

import java.util.Objects;

/**
 * A contract-level storage variable.
 *
 * <p>When {@code type} names another contract of the same run the variable becomes a
 * composition edge (see {@link CompositionEdge}).
 *
 * @param name variable name
 * @param type raw declared type
 * @param visibility declared visibility, internal when omitted
 * @param mapping whether the type is a key-value mapping
 */
public record StateVariable(
    String name,
    String type,
    Visibility visibility,
    boolean mapping
) {
    /**
     * Compact constructor with validation.
     */
    public StateVariable {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (visibility == null) {
            visibility = Visibility.INTERNAL;
        }
    }
}

package com.solseq.core.model;

import java.util.Objects;

/**
 * A function parameter or return value.
 *
 * @param name parameter name, empty for unnamed parameters
 * @param type raw type string (e.g. "uint256", "address payable")
 */
public record Parameter(
    String name,
    String type
) {
    /**
     * Compact constructor with validation.
     */
    public Parameter {
        Objects.requireNonNull(type, "type must not be null");
        if (name == null) {
            name = "";
        }
    }

    /**
     * Returns whether this parameter has a name.
     *
     * @return true if the name is not blank
     */
    public boolean isNamed() {
        return !name.isBlank();
    }
}

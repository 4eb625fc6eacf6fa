package com.solseq.core.model;

import java.util.Objects;

/**
 * A state variable typed with a user-defined name that matches no contract of the run.
 *
 * @param owner contract declaring the variable
 * @param variable variable name
 * @param typeName unresolved type name
 */
public record ExternalReference(
    String owner,
    String variable,
    String typeName
) {
    /**
     * Compact constructor with validation.
     */
    public ExternalReference {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(typeName, "typeName must not be null");
    }
}

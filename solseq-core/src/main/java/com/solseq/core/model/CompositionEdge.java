package com.solseq.core.model;

import java.util.Objects;

/**
 * A state variable whose declared type is another contract of the same run.
 *
 * @param owner contract declaring the variable
 * @param variable variable name
 * @param target name of the referenced contract
 */
public record CompositionEdge(
    String owner,
    String variable,
    String target
) {
    /**
     * Compact constructor with validation.
     */
    public CompositionEdge {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }
}

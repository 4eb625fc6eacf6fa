package com.solseq.core.model;

import java.util.Objects;

/**
 * A parameter of an event declaration.
 *
 * @param name parameter name, empty for unnamed parameters
 * @param type raw type string
 * @param indexed whether the parameter is declared {@code indexed}
 */
public record EventParameter(
    String name,
    String type,
    boolean indexed
) {
    /**
     * Compact constructor with validation.
     */
    public EventParameter {
        Objects.requireNonNull(type, "type must not be null");
        if (name == null) {
            name = "";
        }
    }
}

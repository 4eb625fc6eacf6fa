package com.solseq.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An event declared by a contract.
 *
 * @param name event name
 * @param parameters ordered event parameters
 */
public record EventUnit(
    String name,
    List<EventParameter> parameters
) {
    /**
     * Compact constructor with validation.
     */
    public EventUnit {
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}

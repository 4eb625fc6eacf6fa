package com.solseq.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A function or constructor of a contract.
 *
 * @param name function name ("constructor" for constructors)
 * @param kind constructor or ordinary function
 * @param visibility declared visibility
 * @param mutability declared state mutability
 * @param parameters ordered parameters
 * @param returns ordered return values, empty when the function returns nothing
 * @param effects classified body statements in source order
 */
public record FunctionUnit(
    String name,
    FunctionKind kind,
    Visibility visibility,
    StateMutability mutability,
    List<Parameter> parameters,
    List<Parameter> returns,
    List<BodyEffect> effects
) {
    /**
     * Compact constructor with validation.
     */
    public FunctionUnit {
        Objects.requireNonNull(name, "name must not be null");
        if (kind == null) {
            kind = FunctionKind.FUNCTION;
        }
        if (visibility == null) {
            visibility = Visibility.PUBLIC;
        }
        if (mutability == null) {
            mutability = StateMutability.NONE;
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        returns = returns == null ? List.of() : List.copyOf(returns);
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    /**
     * Returns whether this function is callable by an external user.
     *
     * @return true for public and external functions and constructors
     */
    public boolean isUserFacing() {
        return visibility.isUserFacing();
    }

    /**
     * Returns the number of declared parameters.
     *
     * @return arity
     */
    public int arity() {
        return parameters.size();
    }
}

package com.solseq.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A classified side-effecting statement inside a function body.
 *
 * <p>Effects are kept in source order; that order becomes the order of the
 * contract-to-contract messages in the diagram.
 */
public interface BodyEffect {

    /**
     * Assignment, compound assignment, increment or {@code delete} on a state variable.
     *
     * @param target name of the state variable being written
     * @param description symbolic rendering of the statement (e.g. "balances[to] += amount")
     */
    record StorageWrite(String target, String description) implements BodyEffect {
        public StorageWrite {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(description, "description must not be null");
        }
    }

    /**
     * Member invocation on a state variable, e.g. {@code token.transfer(to, amount)}.
     *
     * @param targetVariable state variable the call is made on
     * @param functionName invoked member name
     * @param arguments rendered argument expressions
     */
    record ExternalCall(String targetVariable, String functionName, List<String> arguments) implements BodyEffect {
        public ExternalCall {
            Objects.requireNonNull(targetVariable, "targetVariable must not be null");
            Objects.requireNonNull(functionName, "functionName must not be null");
            arguments = arguments == null ? List.of() : List.copyOf(arguments);
        }
    }

    /**
     * An {@code emit} statement.
     *
     * @param eventName emitted event, referenced by name only
     * @param arguments rendered argument expressions
     */
    record EmitEvent(String eventName, List<String> arguments) implements BodyEffect {
        public EmitEvent {
            Objects.requireNonNull(eventName, "eventName must not be null");
            arguments = arguments == null ? List.of() : List.copyOf(arguments);
        }
    }
}

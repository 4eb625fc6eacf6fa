package com.solseq.core.correlate;

import java.util.List;
import java.util.Objects;

/**
 * A message of the contract-to-contract section, derived from one body effect.
 */
public interface DiagramMessage {

    /**
     * Call from one contract to another, rendered as an activation arrow pair.
     *
     * @param from calling contract
     * @param to called contract
     * @param function invoked function name
     * @param arguments rendered argument expressions
     */
    record Call(String from, String to, String function, List<String> arguments) implements DiagramMessage {
        public Call {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(to, "to must not be null");
            Objects.requireNonNull(function, "function must not be null");
            arguments = arguments == null ? List.of() : List.copyOf(arguments);
        }
    }

    /**
     * Event emission, rendered as an arrow to the shared events participant.
     *
     * @param from emitting contract
     * @param event event name
     * @param arguments rendered argument expressions
     */
    record Emit(String from, String event, List<String> arguments) implements DiagramMessage {
        public Emit {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(event, "event must not be null");
            arguments = arguments == null ? List.of() : List.copyOf(arguments);
        }
    }

    /**
     * Storage update, rendered as a note without an arrow.
     *
     * @param contract contract whose storage is written
     * @param description statement text
     */
    record StorageNote(String contract, String description) implements DiagramMessage {
        public StorageNote {
            Objects.requireNonNull(contract, "contract must not be null");
            Objects.requireNonNull(description, "description must not be null");
        }
    }
}

package com.solseq.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A contract, interface or library together with its members.
 *
 * <p>Function names need not be unique. When a name is overloaded the diagram labels
 * each overload as {@code name/arity} (see {@link #labelOf(FunctionUnit)}).
 *
 * @param name contract name
 * @param kind declaration kind
 * @param baseContracts ordered inheritance list, without duplicates
 * @param origin file path, buffer name or AST node reference the contract came from
 * @param stateVariables ordered state variables
 * @param functions ordered functions and constructors
 * @param events ordered events declared by this contract
 */
public record ContractUnit(
    String name,
    ContractKind kind,
    List<String> baseContracts,
    String origin,
    List<StateVariable> stateVariables,
    List<FunctionUnit> functions,
    List<EventUnit> events
) {
    /**
     * Compact constructor with validation.
     */
    public ContractUnit {
        Objects.requireNonNull(name, "name must not be null");
        if (kind == null) {
            kind = ContractKind.CONTRACT;
        }
        if (origin == null) {
            origin = "";
        }
        baseContracts = baseContracts == null ? List.of() : List.copyOf(baseContracts);
        Set<String> seen = new HashSet<>();
        for (String base : baseContracts) {
            if (!seen.add(base)) {
                throw new IllegalArgumentException(
                    "Duplicate base contract '" + base + "' in inheritance list of " + name);
            }
        }
        stateVariables = stateVariables == null ? List.of() : List.copyOf(stateVariables);
        functions = functions == null ? List.of() : List.copyOf(functions);
        events = events == null ? List.of() : List.copyOf(events);
    }

    /**
     * Looks up a state variable declared directly by this contract.
     *
     * @param variableName variable name
     * @return the variable, or empty if not declared here
     */
    public Optional<StateVariable> findStateVariable(String variableName) {
        return stateVariables.stream()
            .filter(variable -> variable.name().equals(variableName))
            .findFirst();
    }

    /**
     * Returns the diagram label of a function: its name, or {@code name/arity} when
     * this contract declares more than one function with that name.
     *
     * @param function a function of this contract
     * @return effective label
     */
    public String labelOf(FunctionUnit function) {
        long sameName = functions.stream()
            .filter(candidate -> candidate.name().equals(function.name()))
            .count();
        return sameName > 1 ? function.name() + "/" + function.arity() : function.name();
    }
}

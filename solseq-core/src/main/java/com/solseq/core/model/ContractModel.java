package com.solseq.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, dialect-independent model of all contracts found in one input.
 *
 * <p>Contract order is first-seen order in the input and drives participant order
 * in the rendered diagram.
 *
 * @param contracts contracts in first-seen order
 * @param compositionEdges resolved contract-typed state variables
 * @param externalReferences user-defined state variable types that resolved to nothing
 */
public record ContractModel(
    List<ContractUnit> contracts,
    List<CompositionEdge> compositionEdges,
    List<ExternalReference> externalReferences
) {
    /**
     * Compact constructor with validation.
     */
    public ContractModel {
        contracts = contracts == null ? List.of() : List.copyOf(contracts);
        compositionEdges = compositionEdges == null ? List.of() : List.copyOf(compositionEdges);
        externalReferences = externalReferences == null ? List.of() : List.copyOf(externalReferences);
    }

    /**
     * Creates a model without contracts.
     *
     * @return empty model
     */
    public static ContractModel empty() {
        return new ContractModel(List.of(), List.of(), List.of());
    }

    /**
     * Finds a contract by exact name.
     *
     * @param name contract name
     * @return the contract, or empty
     */
    public Optional<ContractUnit> findContract(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return contracts.stream()
            .filter(contract -> contract.name().equals(name))
            .findFirst();
    }

    /**
     * Finds the composition edge for a state variable declared by {@code owner}.
     *
     * @param owner contract declaring the variable
     * @param variable variable name
     * @return the edge, or empty when the variable's type is not a contract of this model
     */
    public Optional<CompositionEdge> findCompositionEdge(String owner, String variable) {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
        return compositionEdges.stream()
            .filter(edge -> edge.owner().equals(owner) && edge.variable().equals(variable))
            .findFirst();
    }

    /**
     * Returns the total number of events across all contracts.
     *
     * @return event count
     */
    public int eventCount() {
        return contracts.stream().mapToInt(contract -> contract.events().size()).sum();
    }
}

package com.solseq.core.builder;

import com.solseq.core.model.CompositionEdge;
import com.solseq.core.model.ContractModel;
import com.solseq.core.model.ContractUnit;
import com.solseq.core.model.EventUnit;
import com.solseq.core.model.ExternalReference;
import com.solseq.core.model.FunctionUnit;
import com.solseq.core.model.StateVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Merges extractor drafts into the canonical, immutable {@link ContractModel}.
 *
 * <p>Merge rules:
 * <ul>
 *   <li>Contracts keep first-seen order, which becomes participant order in the diagram.</li>
 *   <li>The first declaration of a name wins its kind and origin. A later declaration
 *       with the same name is a re-opened fragment: its bases and members are appended,
 *       exact duplicates are skipped, and nothing earlier is replaced.</li>
 *   <li>A state variable whose type equals the name of a contract in the model becomes a
 *       {@link CompositionEdge}; other user-defined-looking types become
 *       {@link ExternalReference}s. Neither case is an error.</li>
 * </ul>
 *
 * <p>Instances are cheap and stateless between calls; all merge state is local to
 * {@link #build(List)}.
 */
public class ContractModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContractModelBuilder.class);

    private static final Pattern USER_DEFINED_TYPE = Pattern.compile("^[A-Z][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*$");

    /**
     * Builds the model from drafts in input order.
     *
     * @param drafts contract drafts, possibly repeating names
     * @return merged model
     */
    public ContractModel build(List<ContractUnit> drafts) {
        Objects.requireNonNull(drafts, "drafts must not be null");

        Map<String, Accumulator> merged = new LinkedHashMap<>();
        for (ContractUnit draft : drafts) {
            Accumulator existing = merged.get(draft.name());
            if (existing == null) {
                merged.put(draft.name(), new Accumulator(draft));
            } else {
                log.debug("Merging re-opened fragment of {} from {}", draft.name(), draft.origin());
                existing.append(draft);
            }
        }

        List<ContractUnit> contracts = merged.values().stream().map(Accumulator::toContract).toList();
        List<CompositionEdge> edges = new ArrayList<>();
        List<ExternalReference> externalReferences = new ArrayList<>();
        for (ContractUnit contract : contracts) {
            for (StateVariable variable : contract.stateVariables()) {
                String type = variable.type();
                if (merged.containsKey(type)) {
                    edges.add(new CompositionEdge(contract.name(), variable.name(), type));
                } else if (!variable.mapping() && USER_DEFINED_TYPE.matcher(type).matches()) {
                    externalReferences.add(new ExternalReference(contract.name(), variable.name(), type));
                }
            }
        }

        log.info("Built contract model: {} contract(s), {} composition edge(s), {} external reference(s)",
            contracts.size(), edges.size(), externalReferences.size());
        return new ContractModel(contracts, edges, externalReferences);
    }

    /**
     * Mutable merge state for one contract name.
     */
    private static final class Accumulator {
        private final ContractUnit first;
        private final List<String> bases;
        private final List<StateVariable> stateVariables;
        private final List<FunctionUnit> functions;
        private final List<EventUnit> events;

        private Accumulator(ContractUnit first) {
            this.first = first;
            this.bases = new ArrayList<>(first.baseContracts());
            this.stateVariables = new ArrayList<>(first.stateVariables());
            this.functions = new ArrayList<>(first.functions());
            this.events = new ArrayList<>(first.events());
        }

        private void append(ContractUnit fragment) {
            appendMissing(bases, fragment.baseContracts());
            appendMissing(stateVariables, fragment.stateVariables());
            appendMissing(functions, fragment.functions());
            appendMissing(events, fragment.events());
        }

        private static <T> void appendMissing(List<T> target, List<T> additions) {
            for (T item : additions) {
                if (!target.contains(item)) {
                    target.add(item);
                }
            }
        }

        private ContractUnit toContract() {
            return new ContractUnit(first.name(), first.kind(), bases, first.origin(), stateVariables, functions, events);
        }
    }
}

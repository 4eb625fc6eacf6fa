package com.solseq.core.correlate;

import com.solseq.core.model.BodyEffect;
import com.solseq.core.model.CompositionEdge;
import com.solseq.core.model.ContractModel;
import com.solseq.core.model.ContractUnit;
import com.solseq.core.model.FunctionUnit;
import com.solseq.core.model.StateVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the body effects of a function into diagram messages.
 *
 * <ul>
 *   <li>{@link BodyEffect.ExternalCall}: a {@link DiagramMessage.Call} when the target
 *       state variable, declared by the contract or one of its bases, has a composition
 *       edge in the model. Calls on anything else are skipped.</li>
 *   <li>{@link BodyEffect.EmitEvent}: a {@link DiagramMessage.Emit}.</li>
 *   <li>{@link BodyEffect.StorageWrite}: a {@link DiagramMessage.StorageNote}.</li>
 * </ul>
 *
 * <p>Messages keep effect order. Repeated calls to the same target stay separate.
 */
public class CallEventCorrelator {

    private static final Logger log = LoggerFactory.getLogger(CallEventCorrelator.class);

    /**
     * Derives the messages of one function.
     *
     * @param model the model the contract belongs to
     * @param contract contract declaring the function
     * @param function function whose effects are correlated
     * @return messages in effect order
     */
    public List<DiagramMessage> correlate(ContractModel model, ContractUnit contract, FunctionUnit function) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(contract, "contract must not be null");
        Objects.requireNonNull(function, "function must not be null");

        List<DiagramMessage> messages = new ArrayList<>();
        for (BodyEffect effect : function.effects()) {
            if (effect instanceof BodyEffect.ExternalCall call) {
                Optional<String> target = resolveTarget(model, contract, call.targetVariable());
                if (target.isPresent()) {
                    messages.add(new DiagramMessage.Call(contract.name(), target.get(), call.functionName(), call.arguments()));
                } else {
                    log.debug("Skipping call {}.{} in {}.{}: target type is not a known contract",
                        call.targetVariable(), call.functionName(), contract.name(), function.name());
                }
            } else if (effect instanceof BodyEffect.EmitEvent emit) {
                messages.add(new DiagramMessage.Emit(contract.name(), emit.eventName(), emit.arguments()));
            } else if (effect instanceof BodyEffect.StorageWrite write) {
                messages.add(new DiagramMessage.StorageNote(contract.name(), write.description()));
            }
        }
        return messages;
    }

    /**
     * Resolves the contract a state variable points to. The declaring contract is found by
     * walking the inheritance chain, the target by its composition edge.
     *
     * @return name of the target contract, or empty when unresolved
     */
    private Optional<String> resolveTarget(ContractModel model, ContractUnit contract, String variableName) {
        Set<String> visited = new HashSet<>();
        Deque<ContractUnit> pending = new ArrayDeque<>();
        pending.add(contract);
        while (!pending.isEmpty()) {
            ContractUnit current = pending.poll();
            if (!visited.add(current.name())) {
                continue;
            }
            Optional<StateVariable> variable = current.findStateVariable(variableName);
            if (variable.isPresent()) {
                return model.findCompositionEdge(current.name(), variableName).map(CompositionEdge::target);
            }
            for (String base : current.baseContracts()) {
                model.findContract(base).ifPresent(pending::add);
            }
        }
        return Optional.empty();
    }
}

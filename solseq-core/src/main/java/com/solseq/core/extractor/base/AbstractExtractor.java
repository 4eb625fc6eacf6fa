package com.solseq.core.extractor.base;

import com.solseq.core.extractor.ContractExtractor;
import com.solseq.core.extractor.ExtractionResult;
import com.solseq.core.model.ContractUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Abstract base class for extractor implementations providing common functionality.
 *
 * <p>This class provides:
 * <ul>
 *   <li>Logger initialization (one logger per extractor class)</li>
 *   <li>ExtractionResult creation helpers ({@link #emptyResult()}, {@link #buildResult(List, List)})</li>
 *   <li>Inherited state variable lookup ({@link #visibleNames(String, Map, Map)})</li>
 * </ul>
 *
 * @param <I> extractor input type
 * @see ContractExtractor
 * @see ExtractionResult
 */
public abstract class AbstractExtractor<I> implements ContractExtractor<I> {

    /**
     * Logger instance for this extractor.
     * Automatically initialized with the concrete extractor class name.
     */
    protected final Logger log;

    protected AbstractExtractor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== Result Creation Helpers ====================

    /**
     * Creates an empty result for this extractor.
     *
     * @return empty result with this extractor's ID
     */
    protected ExtractionResult emptyResult() {
        return ExtractionResult.empty(getId());
    }

    /**
     * Creates a result with the given drafts and warnings.
     *
     * @param contracts contract drafts in input order
     * @param warnings non-fatal issues
     * @return extraction result
     */
    protected ExtractionResult buildResult(List<ContractUnit> contracts, List<String> warnings) {
        log.info("{} extracted {} contract(s) with {} warning(s)", getDisplayName(), contracts.size(), warnings.size());
        return new ExtractionResult(getId(), contracts, warnings);
    }

    // ==================== Inheritance Helper ====================

    /**
     * Collects names declared by a contract and, transitively, by its bases.
     *
     * <p>Used to decide which identifiers in a function body refer to state variables,
     * including variables inherited from other contracts of the same input. Cycles and
     * unknown bases are ignored.
     *
     * @param contract contract name
     * @param basesByContract declared bases per contract name
     * @param namesByContract names declared directly by each contract
     * @return own names first, then inherited ones in breadth-first base order
     */
    protected Set<String> visibleNames(String contract,
                                       Map<String, List<String>> basesByContract,
                                       Map<String, Set<String>> namesByContract) {
        Set<String> names = new LinkedHashSet<>();
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(contract);
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (!visited.add(current)) {
                continue;
            }
            names.addAll(namesByContract.getOrDefault(current, Set.of()));
            pending.addAll(basesByContract.getOrDefault(current, List.of()));
        }
        return names;
    }
}

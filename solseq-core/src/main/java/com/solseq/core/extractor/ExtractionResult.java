package com.solseq.core.extractor;

import com.solseq.core.model.ContractUnit;

import java.util.List;
import java.util.Objects;

/**
 * Result returned by an extractor.
 *
 * @param extractorId ID of the extractor that produced this result
 * @param contracts contract drafts in input order, possibly with repeated names
 * @param warnings non-fatal issues, such as skipped fragments or unbalanced braces
 */
public record ExtractionResult(
    String extractorId,
    List<ContractUnit> contracts,
    List<String> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public ExtractionResult {
        Objects.requireNonNull(extractorId, "extractorId must not be null");
        contracts = contracts == null ? List.of() : List.copyOf(contracts);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Creates a result with no contracts and no warnings.
     *
     * @param extractorId extractor ID
     * @return empty result
     */
    public static ExtractionResult empty(String extractorId) {
        return new ExtractionResult(extractorId, List.of(), List.of());
    }
}

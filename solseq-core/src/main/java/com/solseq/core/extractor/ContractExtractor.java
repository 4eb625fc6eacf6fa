package com.solseq.core.extractor;

/**
 * Turns one kind of input into contract drafts.
 *
 * <p>Extractors report what they found in an {@link ExtractionResult}; the drafts may
 * contain the same contract name more than once (re-opened fragments), which the
 * {@link com.solseq.core.builder.ContractModelBuilder} merges.
 *
 * <p>Extractors are stateless between calls and may be shared.
 *
 * @param <I> input type, e.g. an AST document or a list of source buffers
 * @see ExtractionResult
 */
public interface ContractExtractor<I> {

    /**
     * Returns unique identifier for this extractor (e.g. "solidity-ast").
     *
     * @return extractor identifier
     */
    String getId();

    /**
     * Returns human-readable display name used in logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Extracts contract drafts from the input.
     *
     * @param input extractor input
     * @return drafts in input order, plus non-fatal warnings
     */
    ExtractionResult extract(I input);
}

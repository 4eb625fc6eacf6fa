package com.solseq.core.generator;

import com.solseq.core.model.ContractModel;

/**
 * Interface for generators that turn a contract model into diagram text.
 *
 * <p>Generators are pure: the same model and configuration always produce
 * byte-identical output, and the model is never modified.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class MermaidSequenceGenerator implements DiagramGenerator {
 *     @Override
 *     public String getId() {
 *         return "mermaid-sequence";
 *     }
 *
 *     @Override
 *     public GeneratedDiagram generate(ContractModel model, GeneratorConfig config) {
 *         String content = ...;
 *         return new GeneratedDiagram("contract-interactions", content, getFileExtension());
 *     }
 * }
 * }</pre>
 *
 * @see ContractModel
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * @return unique generator identifier, lowercase
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated diagrams.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Generates a diagram from the contract model.
     *
     * <p>An empty model still yields a complete diagram with the synthetic participants,
     * section titles and legend.
     *
     * @param model the contract model to visualize
     * @param config configuration settings for generation
     * @return generated diagram content
     */
    GeneratedDiagram generate(ContractModel model, GeneratorConfig config);
}

package com.solseq.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.solseq.core.ast.AstDocument;
import com.solseq.core.ast.AstDocumentReader;
import com.solseq.core.builder.ContractModelBuilder;
import com.solseq.core.extractor.ExtractionResult;
import com.solseq.core.extractor.ast.AstContractExtractor;
import com.solseq.core.extractor.source.SolidityLexicalExtractor;
import com.solseq.core.extractor.source.SourceBuffer;
import com.solseq.core.generator.DiagramGenerator;
import com.solseq.core.generator.GeneratedDiagram;
import com.solseq.core.generator.GeneratorConfig;
import com.solseq.core.generator.impl.MermaidSequenceGenerator;
import com.solseq.core.model.ContractModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for one diagram run.
 *
 * <p>Wires input reading, extraction, model building and rendering:
 * <pre>
 * AST JSON   -&gt; AstDocumentReader -&gt; AstContractExtractor     \
 *                                                               -&gt; ContractModelBuilder -&gt; DiagramGenerator
 * source text -&gt; SolidityLexicalExtractor                      /
 * </pre>
 *
 * <p>A run takes exactly one kind of input. The engine never touches the filesystem;
 * callers persist {@link GeneratedDiagram#content()} themselves. Instances hold no per-run
 * state and can be reused.
 */
public class ContractDiagramEngine {

    private static final Logger log = LoggerFactory.getLogger(ContractDiagramEngine.class);

    private final AstDocumentReader documentReader;
    private final AstContractExtractor astExtractor;
    private final SolidityLexicalExtractor sourceExtractor;
    private final DiagramGenerator generator;

    public ContractDiagramEngine() {
        this(new AstDocumentReader(), new AstContractExtractor(), new SolidityLexicalExtractor(),
            new MermaidSequenceGenerator());
    }

    public ContractDiagramEngine(AstDocumentReader documentReader,
                                 AstContractExtractor astExtractor,
                                 SolidityLexicalExtractor sourceExtractor,
                                 DiagramGenerator generator) {
        this.documentReader = Objects.requireNonNull(documentReader, "documentReader must not be null");
        this.astExtractor = Objects.requireNonNull(astExtractor, "astExtractor must not be null");
        this.sourceExtractor = Objects.requireNonNull(sourceExtractor, "sourceExtractor must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
    }

    /**
     * Generates a diagram from AST JSON text.
     *
     * @param astJson AST document text
     * @param config generator configuration
     * @return the diagram
     * @throws com.solseq.core.ast.AstFormatException if the document is not a usable AST
     */
    public GeneratedDiagram generateFromAst(String astJson, GeneratorConfig config) {
        return render(buildModelFromAst(astJson), config);
    }

    /**
     * Generates a diagram from an already parsed AST JSON tree.
     *
     * @param astRoot AST document root
     * @param config generator configuration
     * @return the diagram
     * @throws com.solseq.core.ast.AstFormatException if the document is not a usable AST
     */
    public GeneratedDiagram generateFromAst(JsonNode astRoot, GeneratorConfig config) {
        return render(buildModelFromAst(astRoot), config);
    }

    /**
     * Generates a diagram from Solidity source buffers, treated as one compilation unit set.
     *
     * @param sources source buffers
     * @param config generator configuration
     * @return the diagram
     */
    public GeneratedDiagram generateFromSources(List<SourceBuffer> sources, GeneratorConfig config) {
        return render(buildModelFromSources(sources), config);
    }

    public ContractModel buildModelFromAst(String astJson) {
        return buildModel(documentReader.read(astJson));
    }

    public ContractModel buildModelFromAst(JsonNode astRoot) {
        return buildModel(documentReader.read(astRoot));
    }

    public ContractModel buildModelFromSources(List<SourceBuffer> sources) {
        ExtractionResult result = sourceExtractor.extract(sources);
        logWarnings(result);
        return new ContractModelBuilder().build(result.contracts());
    }

    /**
     * Renders a model.
     *
     * @param model contract model
     * @param config generator configuration
     * @return the diagram
     */
    public GeneratedDiagram render(ContractModel model, GeneratorConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return generator.generate(model, config);
    }

    private ContractModel buildModel(AstDocument document) {
        ExtractionResult result = astExtractor.extract(document);
        logWarnings(result);
        return new ContractModelBuilder().build(result.contracts());
    }

    private void logWarnings(ExtractionResult result) {
        for (String warning : result.warnings()) {
            log.warn("[{}] {}", result.extractorId(), warning);
        }
    }
}

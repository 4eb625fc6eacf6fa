package com.solseq.core.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses and validates AST JSON documents.
 *
 * <p>Accepted layouts:
 * <ul>
 *   <li>{@code solc --combined-json ast}: {@code {"sources": {"A.sol": {"AST": {...}}}}}</li>
 *   <li>standard-json output: {@code {"sources": {"A.sol": {"ast": {...}}}}}, or {@code legacyAST}</li>
 *   <li>a single {@code {"ast": {...}}} wrapper</li>
 *   <li>a bare SourceUnit, in either dialect</li>
 *   <li>a JSON array of SourceUnits</li>
 * </ul>
 *
 * <p>Every SourceUnit must carry its child list ({@code nodes} or {@code children});
 * otherwise an {@link AstFormatException} is thrown before anything is extracted.
 */
public class AstDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(AstDocumentReader.class);

    private static final String SOURCE_UNIT = "SourceUnit";
    private static final List<String> SOURCE_AST_KEYS = List.of("AST", "ast", "legacyAST");

    private final ObjectMapper objectMapper;

    public AstDocumentReader() {
        this(new ObjectMapper());
    }

    public AstDocumentReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Parses JSON text into a validated document.
     *
     * @param json raw JSON text
     * @return validated document
     * @throws AstFormatException if the text is not JSON or not an AST
     */
    public AstDocument read(String json) {
        Objects.requireNonNull(json, "json must not be null");
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AstFormatException("Input is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new AstFormatException("Input is empty");
        }
        return read(root);
    }

    /**
     * Validates an already parsed JSON tree.
     *
     * @param root JSON root
     * @return validated document
     * @throws AstFormatException if the tree is not an AST
     */
    public AstDocument read(JsonNode root) {
        Objects.requireNonNull(root, "root must not be null");
        List<AstDocument.Source> sources = new ArrayList<>();

        if (root.isArray()) {
            for (JsonNode unit : root) {
                sources.add(sourceUnit(unit, null));
            }
        } else if (!root.isObject()) {
            throw new AstFormatException("AST document must be a JSON object or array, found " + root.getNodeType());
        } else if (root.has("sources") && root.get("sources").isObject()) {
            Iterator<Map.Entry<String, JsonNode>> entries = root.get("sources").fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                sources.add(sourceUnit(unwrapSourceEntry(entry.getKey(), entry.getValue()), entry.getKey()));
            }
        } else if (root.has("ast") && root.get("ast").isObject()) {
            sources.add(sourceUnit(root.get("ast"), null));
        } else if (root.has("AST") && root.get("AST").isObject()) {
            sources.add(sourceUnit(root.get("AST"), null));
        } else {
            sources.add(sourceUnit(root, null));
        }

        log.debug("Read AST document with {} source unit(s)", sources.size());
        return new AstDocument(sources);
    }

    private JsonNode unwrapSourceEntry(String sourceKey, JsonNode entry) {
        for (String key : SOURCE_AST_KEYS) {
            JsonNode candidate = entry.get(key);
            if (candidate != null && candidate.isObject()) {
                return candidate;
            }
        }
        throw new AstFormatException("Source '" + sourceKey + "' has no AST (expected one of " + SOURCE_AST_KEYS + ")");
    }

    private AstDocument.Source sourceUnit(JsonNode unit, String sourceKey) {
        if (unit == null || !unit.isObject()) {
            throw new AstFormatException("SourceUnit must be a JSON object" + describe(sourceKey));
        }

        boolean compact = unit.has("nodeType");
        String kind = compact ? unit.get("nodeType").asText() : unit.path("name").asText();
        if (!SOURCE_UNIT.equals(kind)) {
            throw new AstFormatException("Expected a SourceUnit node but found '" + kind + "'" + describe(sourceKey));
        }

        JsonNode childList = compact ? unit.get("nodes") : unit.get("children");
        if (childList == null || !childList.isArray()) {
            throw new AstFormatException("SourceUnit has no '" + (compact ? "nodes" : "children") + "' array"
                + describe(sourceKey));
        }

        return new AstDocument.Source(sourceIdOf(unit, sourceKey), new AstNode(unit));
    }

    private static String sourceIdOf(JsonNode unit, String sourceKey) {
        if (sourceKey != null) {
            return sourceKey;
        }
        String path = unit.path("absolutePath").asText("");
        if (path.isEmpty()) {
            path = unit.path("attributes").path("absolutePath").asText("");
        }
        return path.isEmpty() ? "ast-node:" + unit.path("id").asText("0") : path;
    }

    private static String describe(String sourceKey) {
        return sourceKey == null ? "" : " (source '" + sourceKey + "')";
    }
}

package com.solseq.core.ast;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link NodeAccessor} for the two JSON AST dialects emitted by solc.
 *
 * <h2>Compact dialect</h2>
 * <p>Produced by {@code --ast-compact-json} and the standard-json {@code ast} output.
 * Each node carries a {@code nodeType} tag, its properties are flat, and children sit
 * under named properties ({@code nodes}, {@code statements}, {@code body}, ...).
 *
 * <h2>Legacy dialect</h2>
 * <p>Produced by {@code --ast-json} and the {@code legacyAST} output of solc 0.4/0.5.
 * The tag is stored under {@code name}, properties under {@code attributes}, and all
 * children in one positional {@code children} array. Roles are therefore resolved by
 * position, and a few property keys differ ({@code member_name}, Identifier
 * {@code value}, {@code type} for the type string).
 *
 * <p>The dialect is detected per node, so a document is never rejected for mixing them.
 */
public class SolcNodeAccessor implements NodeAccessor {

    private static final String NODE_TYPE = "nodeType";
    private static final String LEGACY_NAME = "name";
    private static final String LEGACY_ATTRIBUTES = "attributes";
    private static final String LEGACY_CHILDREN = "children";

    // Roles whose legacy position is the same for every node kind that has them
    private static final Map<String, Integer> LEGACY_POSITIONAL_ROLES = Map.ofEntries(
        Map.entry("expression", 0),
        Map.entry("eventCall", 0),
        Map.entry("leftHandSide", 0),
        Map.entry("rightHandSide", 1),
        Map.entry("subExpression", 0),
        Map.entry("baseExpression", 0),
        Map.entry("indexExpression", 1),
        Map.entry("baseType", 0),
        Map.entry("length", 1),
        Map.entry("keyType", 0),
        Map.entry("valueType", 1),
        Map.entry("baseName", 0),
        Map.entry("condition", 0),
        Map.entry("trueBody", 1),
        Map.entry("falseBody", 2),
        Map.entry("trueExpression", 1),
        Map.entry("falseExpression", 2),
        Map.entry("leftExpression", 0),
        Map.entry("rightExpression", 1)
    );

    @Override
    public String nodeKind(AstNode node) {
        JsonNode json = node.json();
        if (isLegacy(json)) {
            return json.get(LEGACY_NAME).asText();
        }
        JsonNode tag = json.get(NODE_TYPE);
        return isScalar(tag) ? tag.asText() : "";
    }

    @Override
    public List<AstNode> childrenOf(AstNode node) {
        JsonNode json = node.json();
        if (isLegacy(json)) {
            return nodesIn(json.get(LEGACY_CHILDREN));
        }

        List<AstNode> children = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            JsonNode value = fields.next().getValue();
            if (isCompactNode(value)) {
                children.add(new AstNode(value));
            } else if (value.isArray()) {
                children.addAll(nodesIn(value));
            }
        }
        // solc writes properties alphabetically; source offsets restore statement order
        if (children.stream().allMatch(child -> sourceOffset(child.json()) >= 0)) {
            children.sort(Comparator.comparingInt(child -> sourceOffset(child.json())));
        }
        return children;
    }

    @Override
    public Optional<String> stringProperty(AstNode node, String key) {
        JsonNode json = node.json();
        if (isLegacy(json)) {
            return legacyProperty(json, key);
        }
        if ("typeString".equals(key)) {
            JsonNode descriptions = json.get("typeDescriptions");
            if (descriptions != null && isScalar(descriptions.get("typeString"))) {
                return Optional.of(descriptions.get("typeString").asText());
            }
        }
        JsonNode value = json.get(key);
        return isScalar(value) ? Optional.of(value.asText()) : Optional.empty();
    }

    @Override
    public Optional<AstNode> child(AstNode node, String role) {
        JsonNode json = node.json();
        if (isLegacy(json)) {
            return legacyChild(node, role);
        }
        JsonNode value = json.get(role);
        return isCompactNode(value) ? Optional.of(new AstNode(value)) : Optional.empty();
    }

    @Override
    public List<AstNode> childList(AstNode node, String role) {
        JsonNode json = node.json();
        if (isLegacy(json)) {
            return legacyChildList(node, role);
        }
        JsonNode value = json.get(role);
        return value != null && value.isArray() ? nodesIn(value) : List.of();
    }

    // ==================== Legacy dialect ====================

    private Optional<String> legacyProperty(JsonNode json, String key) {
        if ("id".equals(key) || "src".equals(key)) {
            JsonNode value = json.get(key);
            return isScalar(value) ? Optional.of(value.asText()) : Optional.empty();
        }
        JsonNode attributes = json.get(LEGACY_ATTRIBUTES);
        if (attributes == null || !attributes.isObject()) {
            return Optional.empty();
        }
        String legacyKey = switch (key) {
            case "typeString" -> "type";
            case "memberName" -> "member_name";
            case "name" -> "Identifier".equals(json.get(LEGACY_NAME).asText()) ? "value" : "name";
            default -> key;
        };
        JsonNode value = attributes.get(legacyKey);
        return isScalar(value) ? Optional.of(value.asText()) : Optional.empty();
    }

    private Optional<AstNode> legacyChild(AstNode node, String role) {
        List<AstNode> children = childrenOf(node);
        String kind = nodeKind(node);
        return switch (role) {
            case "body" -> children.isEmpty() || !isKind(children.get(children.size() - 1), "Block")
                ? Optional.empty()
                : Optional.of(children.get(children.size() - 1));
            case "parameters" -> nthOfKind(children, "ParameterList", 0);
            case "returnParameters" -> nthOfKind(children, "ParameterList", 1);
            case "typeName" -> children.isEmpty() || !isTypeNameKind(nodeKind(children.get(0)))
                ? Optional.empty()
                : Optional.of(children.get(0));
            case "value", "initialValue" -> legacyInitializer(kind, children);
            default -> {
                Integer position = LEGACY_POSITIONAL_ROLES.get(role);
                yield position != null && position < children.size()
                    ? Optional.of(children.get(position))
                    : Optional.empty();
            }
        };
    }

    private List<AstNode> legacyChildList(AstNode node, String role) {
        List<AstNode> children = childrenOf(node);
        String kind = nodeKind(node);
        return switch (role) {
            case "nodes" -> "ContractDefinition".equals(kind)
                ? children.stream().filter(c -> !isKind(c, "InheritanceSpecifier")).toList()
                : children;
            case "baseContracts" -> children.stream().filter(c -> isKind(c, "InheritanceSpecifier")).toList();
            case "declarations" -> children.stream().filter(c -> isKind(c, "VariableDeclaration")).toList();
            case "arguments" -> "FunctionCall".equals(kind) && children.size() > 1
                ? children.subList(1, children.size())
                : List.of();
            case "parameters", "statements", "components" -> children;
            default -> List.of();
        };
    }

    private Optional<AstNode> legacyInitializer(String kind, List<AstNode> children) {
        if ("VariableDeclaration".equals(kind)) {
            return children.size() > 1 ? Optional.of(children.get(1)) : Optional.empty();
        }
        if (!children.isEmpty()) {
            AstNode last = children.get(children.size() - 1);
            if (!isKind(last, "VariableDeclaration")) {
                return Optional.of(last);
            }
        }
        return Optional.empty();
    }

    private Optional<AstNode> nthOfKind(List<AstNode> children, String kind, int index) {
        return children.stream()
            .filter(child -> isKind(child, kind))
            .skip(index)
            .findFirst();
    }

    private static boolean isTypeNameKind(String kind) {
        return kind.endsWith("TypeName") || "Mapping".equals(kind);
    }

    // ==================== Shared helpers ====================

    private static boolean isLegacy(JsonNode json) {
        if (json.has(NODE_TYPE)) {
            return false;
        }
        JsonNode tag = json.get(LEGACY_NAME);
        return tag != null && tag.isTextual()
            && (json.has(LEGACY_CHILDREN) || json.has(LEGACY_ATTRIBUTES) || json.has("id"));
    }

    private static int sourceOffset(JsonNode json) {
        JsonNode src = json.get("src");
        if (src == null || !src.isTextual()) {
            return -1;
        }
        String text = src.asText();
        int colon = text.indexOf(':');
        try {
            return Integer.parseInt(colon < 0 ? text : text.substring(0, colon));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static boolean isCompactNode(JsonNode value) {
        return value != null && value.isObject() && value.has(NODE_TYPE);
    }

    private static boolean isScalar(JsonNode value) {
        return value != null && !value.isNull() && value.isValueNode();
    }

    private static List<AstNode> nodesIn(JsonNode array) {
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<AstNode> nodes = new ArrayList<>();
        for (JsonNode element : array) {
            if (element.isObject() && (element.has(NODE_TYPE) || isLegacy(element))) {
                nodes.add(new AstNode(element));
            }
        }
        return nodes;
    }
}

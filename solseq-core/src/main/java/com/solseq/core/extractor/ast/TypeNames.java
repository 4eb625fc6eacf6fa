package com.solseq.core.extractor.ast;

import com.solseq.core.ast.AstNode;
import com.solseq.core.ast.NodeAccessor;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Renders AST type nodes as Solidity type strings.
 *
 * <p>Type nodes are preferred over {@code typeDescriptions.typeString} because the latter
 * carries data locations and {@code contract}/{@code struct} prefixes. The type string is
 * still used, cleaned, when a node kind is not recognised.
 */
final class TypeNames {

    static final String UNKNOWN = "unknown";

    private static final Pattern KIND_PREFIX = Pattern.compile("^(contract|struct|enum|type\\(contract)\\s+");
    private static final Pattern LOCATION_SUFFIX = Pattern.compile("\\s+(storage ref|storage pointer|storage|memory|calldata)\\b");

    private TypeNames() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Renders the declared type of a VariableDeclaration node.
     */
    static String ofDeclaration(NodeAccessor accessor, AstNode declaration) {
        Optional<AstNode> typeName = accessor.child(declaration, "typeName");
        if (typeName.isPresent()) {
            return render(accessor, typeName.get());
        }
        return accessor.stringProperty(declaration, "typeString").map(TypeNames::clean).orElse(UNKNOWN);
    }

    static String render(NodeAccessor accessor, AstNode type) {
        return switch (accessor.nodeKind(type)) {
            case "ElementaryTypeName" -> elementary(accessor, type);
            case "UserDefinedTypeName" -> userDefined(accessor, type);
            case "ArrayTypeName" -> {
                String base = accessor.child(type, "baseType").map(node -> render(accessor, node)).orElse(UNKNOWN);
                String length = accessor.child(type, "length")
                    .flatMap(node -> accessor.stringProperty(node, "value"))
                    .orElse("");
                yield base + "[" + length + "]";
            }
            case "Mapping" -> {
                String key = accessor.child(type, "keyType").map(node -> render(accessor, node)).orElse(UNKNOWN);
                String value = accessor.child(type, "valueType").map(node -> render(accessor, node)).orElse(UNKNOWN);
                yield "mapping(" + key + " => " + value + ")";
            }
            case "FunctionTypeName" -> "function";
            default -> accessor.stringProperty(type, "typeString").map(TypeNames::clean).orElse(UNKNOWN);
        };
    }

    static boolean isMapping(NodeAccessor accessor, AstNode declaration, String renderedType) {
        return accessor.child(declaration, "typeName").map(node -> accessor.isKind(node, "Mapping")).orElse(false)
            || renderedType.startsWith("mapping(");
    }

    /**
     * Strips data locations and kind prefixes from a compiler type string.
     */
    static String clean(String typeString) {
        String cleaned = KIND_PREFIX.matcher(typeString.trim()).replaceFirst("");
        cleaned = LOCATION_SUFFIX.matcher(cleaned).replaceAll("");
        if (typeString.startsWith("type(contract") && cleaned.endsWith(")")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        return cleaned.trim();
    }

    private static String elementary(NodeAccessor accessor, AstNode type) {
        String name = accessor.stringProperty(type, "name")
            .or(() -> accessor.stringProperty(type, "type"))
            .or(() -> accessor.stringProperty(type, "typeString"))
            .orElse(UNKNOWN);
        boolean payable = accessor.stringProperty(type, "stateMutability").map("payable"::equals).orElse(false);
        return payable && "address".equals(name) ? "address payable" : name;
    }

    private static String userDefined(NodeAccessor accessor, AstNode type) {
        return accessor.child(type, "pathNode")
            .flatMap(path -> accessor.stringProperty(path, "name"))
            .or(() -> accessor.stringProperty(type, "name"))
            .or(() -> accessor.stringProperty(type, "typeString").map(TypeNames::clean))
            .orElse(UNKNOWN);
    }
}

package com.solseq.core.extractor.ast;

import com.solseq.core.ast.AstNode;
import com.solseq.core.ast.NodeAccessor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints expression nodes back to compact Solidity-like text for diagram labels.
 *
 * <p>Output is for reading, not re-parsing: unknown expression kinds fall back to their
 * type string or kind tag.
 */
class ExpressionPrinter {

    private final NodeAccessor accessor;

    ExpressionPrinter(NodeAccessor accessor) {
        this.accessor = accessor;
    }

    String print(AstNode node) {
        return switch (accessor.nodeKind(node)) {
            case "Identifier" -> property(node, "name");
            case "Literal" -> literal(node);
            case "MemberAccess" -> role(node, "expression") + "." + property(node, "memberName");
            case "IndexAccess" -> role(node, "baseExpression") + "["
                + accessor.child(node, "indexExpression").map(this::print).orElse("") + "]";
            case "FunctionCall" -> role(node, "expression") + "(" + join(accessor.childList(node, "arguments")) + ")";
            case "FunctionCallOptions" -> role(node, "expression");
            case "BinaryOperation" -> role(node, "leftExpression") + " " + property(node, "operator") + " "
                + role(node, "rightExpression");
            case "UnaryOperation" -> unary(node);
            case "Assignment" -> role(node, "leftHandSide") + " " + property(node, "operator") + " "
                + role(node, "rightHandSide");
            case "TupleExpression" -> "(" + join(accessor.childList(node, "components")) + ")";
            case "Conditional" -> role(node, "condition") + " ? " + role(node, "trueExpression") + " : "
                + role(node, "falseExpression");
            case "NewExpression" -> "new " + accessor.child(node, "typeName")
                .map(type -> TypeNames.render(accessor, type))
                .orElse(TypeNames.UNKNOWN);
            case "ElementaryTypeNameExpression" -> accessor.child(node, "typeName")
                .map(type -> TypeNames.render(accessor, type))
                .or(() -> accessor.stringProperty(node, "value"))
                .orElseGet(() -> property(node, "typeString"));
            default -> accessor.stringProperty(node, "name")
                .or(() -> accessor.stringProperty(node, "typeString").map(TypeNames::clean))
                .orElse(accessor.nodeKind(node));
        };
    }

    List<String> printAll(List<AstNode> nodes) {
        return nodes.stream().map(this::print).toList();
    }

    private String literal(AstNode node) {
        String kind = accessor.stringProperty(node, "kind").orElse("");
        String raw = accessor.stringProperty(node, "value")
            .or(() -> accessor.stringProperty(node, "hexValue").map(hex -> "hex\"" + hex + "\""))
            .orElse("");
        String value = "string".equals(kind) ? "\"" + raw + "\"" : raw;
        return accessor.stringProperty(node, "subdenomination")
            .map(unit -> value + " " + unit)
            .orElse(value);
    }

    private String unary(AstNode node) {
        String operator = property(node, "operator");
        String operand = role(node, "subExpression");
        if ("delete".equals(operator)) {
            return "delete " + operand;
        }
        return accessor.booleanProperty(node, "prefix") ? operator + operand : operand + operator;
    }

    private String role(AstNode node, String role) {
        return accessor.child(node, role).map(this::print).orElse("");
    }

    private String property(AstNode node, String key) {
        return accessor.stringProperty(node, key).orElse("");
    }

    private String join(List<AstNode> nodes) {
        return nodes.stream().map(this::print).collect(Collectors.joining(", "));
    }
}

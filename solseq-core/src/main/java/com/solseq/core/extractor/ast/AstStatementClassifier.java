package com.solseq.core.extractor.ast;

import com.solseq.core.ast.AstNode;
import com.solseq.core.ast.NodeAccessor;
import com.solseq.core.model.BodyEffect;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies the statements of a function body into {@link BodyEffect}s.
 *
 * <p>Recognised shapes:
 * <ul>
 *   <li>{@code stateVar.member(args)}: external call on a state variable</li>
 *   <li>{@code emit Event(args)}, and the pre-0.4.21 bare {@code Event(args)} form</li>
 *   <li>assignment, {@code ++}, {@code --} or {@code delete} whose target is rooted at a state variable</li>
 * </ul>
 *
 * <p>Parameters and local variables shadow state variables of the same name.
 * Arguments are visited before the call that consumes them, the right-hand side of an
 * assignment before the write.
 */
class AstStatementClassifier {

    private static final Set<String> WRITING_UNARY_OPERATORS = Set.of("++", "--", "delete");

    private final NodeAccessor accessor;
    private final ExpressionPrinter printer;

    AstStatementClassifier(NodeAccessor accessor, ExpressionPrinter printer) {
        this.accessor = accessor;
        this.printer = printer;
    }

    /**
     * Classifies a function body.
     *
     * @param body the function's Block node
     * @param stateVariables state variables visible in the function, inherited ones included
     * @param localNames parameter and named return names
     * @param eventNames events declared by the contract
     * @return effects in source order
     */
    List<BodyEffect> classify(AstNode body, Set<String> stateVariables, Set<String> localNames, Set<String> eventNames) {
        Scope scope = new Scope(stateVariables, new HashSet<>(localNames), eventNames);
        visit(body, scope);
        return scope.effects;
    }

    private void visit(AstNode node, Scope scope) {
        switch (accessor.nodeKind(node)) {
            case "EmitStatement" -> accessor.child(node, "eventCall").ifPresent(call -> visitEmit(call, scope));
            case "VariableDeclarationStatement" -> {
                accessor.child(node, "initialValue").ifPresent(value -> visit(value, scope));
                for (AstNode declaration : accessor.childList(node, "declarations")) {
                    accessor.stringProperty(declaration, "name").ifPresent(scope.locals::add);
                }
            }
            case "Assignment" -> {
                accessor.child(node, "rightHandSide").ifPresent(rhs -> visit(rhs, scope));
                accessor.child(node, "leftHandSide").ifPresent(lhs -> {
                    visit(lhs, scope);
                    recordWrite(lhs, node, scope);
                });
            }
            case "UnaryOperation" -> accessor.child(node, "subExpression").ifPresent(operand -> {
                visit(operand, scope);
                String operator = accessor.stringProperty(node, "operator").orElse("");
                if (WRITING_UNARY_OPERATORS.contains(operator)) {
                    recordWrite(operand, node, scope);
                }
            });
            case "FunctionCall" -> visitCall(node, scope);
            default -> accessor.childrenOf(node).forEach(child -> visit(child, scope));
        }
    }

    private void visitEmit(AstNode call, Scope scope) {
        List<AstNode> arguments = accessor.childList(call, "arguments");
        arguments.forEach(argument -> visit(argument, scope));
        String eventName = accessor.child(call, "expression").map(this::calleeName).orElse("");
        if (!eventName.isEmpty()) {
            scope.effects.add(new BodyEffect.EmitEvent(eventName, printer.printAll(arguments)));
        }
    }

    private void visitCall(AstNode call, Scope scope) {
        List<AstNode> arguments = accessor.childList(call, "arguments");
        arguments.forEach(argument -> visit(argument, scope));

        Optional<AstNode> callee = accessor.child(call, "expression").map(this::unwrapCallOptions);
        if (callee.isEmpty()) {
            return;
        }
        AstNode target = callee.get();

        if (accessor.isKind(target, "MemberAccess")) {
            Optional<AstNode> receiver = accessor.child(target, "expression");
            receiver.ifPresent(node -> visit(node, scope));
            Optional<String> variable = receiver
                .filter(node -> accessor.isKind(node, "Identifier"))
                .flatMap(node -> accessor.stringProperty(node, "name"))
                .filter(scope::isStateVariable);
            if (variable.isPresent()) {
                String member = accessor.stringProperty(target, "memberName").orElse("");
                scope.effects.add(new BodyEffect.ExternalCall(variable.get(), member, printer.printAll(arguments)));
            }
        } else if (accessor.isKind(target, "Identifier")) {
            accessor.stringProperty(target, "name")
                .filter(scope.events::contains)
                .ifPresent(event -> scope.effects.add(new BodyEffect.EmitEvent(event, printer.printAll(arguments))));
        } else {
            visit(target, scope);
        }
    }

    private void recordWrite(AstNode target, AstNode statement, Scope scope) {
        rootIdentifier(target)
            .filter(scope::isStateVariable)
            .ifPresent(variable -> scope.effects.add(new BodyEffect.StorageWrite(variable, printer.print(statement))));
    }

    private Optional<String> rootIdentifier(AstNode node) {
        AstNode current = node;
        while (true) {
            String kind = accessor.nodeKind(current);
            Optional<AstNode> next;
            if ("Identifier".equals(kind)) {
                return accessor.stringProperty(current, "name");
            } else if ("IndexAccess".equals(kind)) {
                next = accessor.child(current, "baseExpression");
            } else if ("MemberAccess".equals(kind)) {
                next = accessor.child(current, "expression");
            } else {
                return Optional.empty();
            }
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
    }

    private AstNode unwrapCallOptions(AstNode callee) {
        if (accessor.isKind(callee, "FunctionCallOptions")) {
            return accessor.child(callee, "expression").orElse(callee);
        }
        return callee;
    }

    private String calleeName(AstNode callee) {
        AstNode target = unwrapCallOptions(callee);
        if (accessor.isKind(target, "MemberAccess")) {
            return accessor.stringProperty(target, "memberName").orElse("");
        }
        return accessor.stringProperty(target, "name").orElseGet(() -> printer.print(target));
    }

    private static final class Scope {
        private final Set<String> stateVariables;
        private final Set<String> locals;
        private final Set<String> events;
        private final List<BodyEffect> effects = new ArrayList<>();

        private Scope(Set<String> stateVariables, Set<String> locals, Set<String> events) {
            this.stateVariables = stateVariables;
            this.locals = locals;
            this.events = events;
        }

        private boolean isStateVariable(String name) {
            return stateVariables.contains(name) && !locals.contains(name);
        }
    }
}

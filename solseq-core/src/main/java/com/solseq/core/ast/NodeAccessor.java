package com.solseq.core.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Read-only, dialect-neutral view over AST nodes.
 *
 * <p>Implementations hide how a producer lays out a node (property names, child list
 * keys, wrapper objects). Absent properties and roles are empty results, never errors.
 *
 * <p>Property keys and role names follow the compact solc AST vocabulary
 * ({@code name}, {@code memberName}, {@code body}, {@code leftHandSide}, ...).
 * Implementations translate them for other dialects.
 */
public interface NodeAccessor {

    /**
     * Returns the kind tag of a node, e.g. {@code "ContractDefinition"}.
     *
     * @param node node to inspect
     * @return kind tag, empty string when the node has none
     */
    String nodeKind(AstNode node);

    /**
     * Returns the ordered structural children of a node.
     *
     * @param node parent node
     * @return children, empty for leaves
     */
    List<AstNode> childrenOf(AstNode node);

    /**
     * Returns a scalar property rendered as text.
     *
     * @param node node to inspect
     * @param key property key in compact vocabulary
     * @return property text, or empty when absent or not a scalar
     */
    Optional<String> stringProperty(AstNode node, String key);

    /**
     * Returns the single child playing a named role.
     *
     * @param node parent node
     * @param role role name, e.g. {@code "body"} or {@code "typeName"}
     * @return child node, or empty when the role is absent
     */
    Optional<AstNode> child(AstNode node, String role);

    /**
     * Returns the ordered children playing a list role.
     *
     * @param node parent node
     * @param role role name, e.g. {@code "nodes"} or {@code "arguments"}
     * @return children, empty when the role is absent
     */
    List<AstNode> childList(AstNode node, String role);

    /**
     * Returns a boolean property; absent properties read as {@code false}.
     *
     * @param node node to inspect
     * @param key property key
     * @return property value
     */
    default boolean booleanProperty(AstNode node, String key) {
        return stringProperty(node, key).map(Boolean::parseBoolean).orElse(false);
    }

    /**
     * Returns whether a node has the given kind.
     *
     * @param node node to inspect
     * @param kind expected kind tag
     * @return true when the kinds match
     */
    default boolean isKind(AstNode node, String kind) {
        return kind.equals(nodeKind(node));
    }

    /**
     * Lazily walks a subtree depth-first in pre-order and yields matching nodes.
     *
     * <p>The walk uses an explicit stack, so deeply nested trees do not grow the call
     * stack. The returned stream can be consumed once.
     *
     * @param node subtree root, included in the walk
     * @param predicate filter applied to each visited node
     * @return matching nodes in pre-order
     */
    default Stream<AstNode> findAll(AstNode node, Predicate<AstNode> predicate) {
        Deque<AstNode> pending = new ArrayDeque<>();
        pending.push(node);
        Spliterator<AstNode> walker = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE, Spliterator.ORDERED) {
            @Override
            public boolean tryAdvance(Consumer<? super AstNode> action) {
                while (!pending.isEmpty()) {
                    AstNode current = pending.pop();
                    List<AstNode> children = childrenOf(current);
                    for (int i = children.size() - 1; i >= 0; i--) {
                        pending.push(children.get(i));
                    }
                    if (predicate.test(current)) {
                        action.accept(current);
                        return true;
                    }
                }
                return false;
            }
        };
        return StreamSupport.stream(walker, false);
    }
}

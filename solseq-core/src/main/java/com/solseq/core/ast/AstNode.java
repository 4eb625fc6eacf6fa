package com.solseq.core.ast;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Opaque handle to one node of an AST document.
 *
 * <p>The wrapped JSON is only visible inside this package; everything else reads
 * nodes through a {@link NodeAccessor}, so dialect-specific property keys never
 * leak into the extractors.
 */
public final class AstNode {

    private final JsonNode json;

    AstNode(JsonNode json) {
        this.json = Objects.requireNonNull(json, "json must not be null");
    }

    JsonNode json() {
        return json;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        // identity of the underlying tree node, not structural JSON equality
        return other instanceof AstNode node && node.json == json;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(json);
    }

    @Override
    public String toString() {
        JsonNode kind = json.has("nodeType") ? json.get("nodeType") : json.get("name");
        return "AstNode[" + (kind == null ? "?" : kind.asText()) + "]";
    }
}

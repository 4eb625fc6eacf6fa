package com.solseq.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A validated AST document: one SourceUnit root per compiled source file.
 *
 * @param sources source units in document order
 */
public record AstDocument(
    List<Source> sources
) {
    /**
     * Compact constructor with validation.
     */
    public AstDocument {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    /**
     * One compiled source file.
     *
     * @param sourceId path or key under which the compiler reported the file
     * @param root the SourceUnit node
     */
    public record Source(String sourceId, AstNode root) {
        public Source {
            Objects.requireNonNull(sourceId, "sourceId must not be null");
            Objects.requireNonNull(root, "root must not be null");
        }
    }
}

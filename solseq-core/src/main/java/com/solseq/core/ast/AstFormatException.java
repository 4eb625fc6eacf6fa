package com.solseq.core.ast;

/**
 * Thrown when an input document is not a usable AST: not JSON, not an object,
 * or lacking a SourceUnit with a child list.
 */
public class AstFormatException extends RuntimeException {

    public AstFormatException(String message) {
        super(message);
    }

    public AstFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

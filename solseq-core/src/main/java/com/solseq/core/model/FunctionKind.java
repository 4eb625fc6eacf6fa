package com.solseq.core.model;

/**
 * Distinguishes constructors from ordinary functions.
 */
public enum FunctionKind {
    CONSTRUCTOR,
    FUNCTION
}

package com.solseq.core.model;

/**
 * Kind of a top-level Solidity declaration.
 */
public enum ContractKind {
    CONTRACT("contract"),
    INTERFACE("interface"),
    LIBRARY("library"),
    ABSTRACT_CONTRACT("abstract");

    private final String keyword;

    ContractKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the keyword used in diagram narration (e.g. "interface").
     *
     * @return lowercase keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Parses a declaration keyword, falling back to {@link #CONTRACT} for unknown values.
     *
     * @param keyword keyword such as "interface", may be null
     * @return matching kind
     */
    public static ContractKind fromKeyword(String keyword) {
        if (keyword == null) {
            return CONTRACT;
        }
        for (ContractKind kind : values()) {
            if (kind.keyword.equalsIgnoreCase(keyword.trim())) {
                return kind;
            }
        }
        return CONTRACT;
    }
}

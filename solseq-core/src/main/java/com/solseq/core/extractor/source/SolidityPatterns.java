package com.solseq.core.extractor.source;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Precompiled patterns and keyword sets for the lexical Solidity extractor.
 *
 * <p>All patterns run against the masked view of a {@link SourceText}, or against
 * single headers and statement fragments cut from it.
 */
final class SolidityPatterns {

    private SolidityPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    static final String IDENTIFIER = "[A-Za-z_$][A-Za-z0-9_$]*";

    /**
     * Contract, interface or library header up to its opening brace.
     * Groups: 1=abstract, 2=kind, 3=name, 4=inheritance list (optional).
     */
    static final Pattern DECLARATION_HEADER = Pattern.compile(
        "\\b(?:(abstract)\\s+)?(contract|interface|library)\\s+(" + IDENTIFIER + ")\\s*(?:\\bis\\b([^{;]*))?\\{");

    /**
     * Leading identifier path of an inheritance specifier, e.g. {@code Ownable} in {@code Ownable(msg.sender)}.
     */
    static final Pattern BASE_NAME = Pattern.compile("^\\s*(" + IDENTIFIER + "(?:\\." + IDENTIFIER + ")*)");

    /**
     * First word of a member header.
     */
    static final Pattern LEADING_WORD = Pattern.compile("^\\s*(" + IDENTIFIER + ")");

    /**
     * {@code returns (} clause of a function header.
     */
    static final Pattern RETURNS_CLAUSE = Pattern.compile("\\breturns\\s*\\(");

    /**
     * Trailing identifier of a declaration, e.g. the parameter name in {@code uint256 amount}.
     */
    static final Pattern TRAILING_NAME = Pattern.compile("\\s(" + IDENTIFIER + ")\\s*$");

    static final Pattern DATA_LOCATION = Pattern.compile("\\b(memory|storage|calldata)\\b");

    static final Pattern OVERRIDE_SPECIFIER = Pattern.compile("\\boverride\\s*(\\([^)]*\\))?");

    /**
     * State variable of function type, e.g. {@code function (uint256) external returns (uint256) callback}.
     * The trailing identifier must not be a function attribute, so bodyless fallbacks do not match.
     */
    static final Pattern FUNCTION_TYPE_VARIABLE = Pattern.compile(
        "^function\\s*\\(.*\\s(?!(?:external|internal|public|private|pure|view|payable|virtual|override)\\b)"
            + IDENTIFIER + "\\s*(?:=(?![=>]).*)?$");

    /**
     * {@code emit Name(}. Group 1=event name.
     */
    static final Pattern EMIT = Pattern.compile("\\bemit\\s+(" + IDENTIFIER + "(?:\\." + IDENTIFIER + ")*)\\s*\\(");

    /**
     * {@code receiver.member(} with optional call options. Groups: 1=receiver, 2=member.
     */
    static final Pattern MEMBER_CALL = Pattern.compile(
        "(?<![A-Za-z0-9_$.])(" + IDENTIFIER + ")\\s*\\.\\s*(" + IDENTIFIER + ")\\s*(?:\\{[^{}]*\\}\\s*)?\\(");

    /**
     * Bare call at fragment start, used for pre-0.4.21 event invocations. Group 1=name.
     */
    static final Pattern BARE_CALL = Pattern.compile("^(" + IDENTIFIER + ")\\s*\\(");

    /**
     * Member access step of an assignment target, e.g. {@code .amount} in {@code stakes[user].amount}.
     */
    static final Pattern MEMBER_ACCESS = Pattern.compile("\\.\\s*" + IDENTIFIER);

    /**
     * Assignment, compound assignment or postfix update operator following an assignment target.
     */
    static final Pattern ASSIGNMENT_OPERATOR = Pattern.compile(
        "=(?![=>])|\\+=|-=|\\*=|/=|%=|\\|=|&=|\\^=|<<=|>>=|\\+\\+|--");

    /**
     * Prefix update, {@code ++x} or {@code --x}. Group 1=root variable.
     */
    static final Pattern PREFIX_UPDATE = Pattern.compile("^(?:\\+\\+|--)\\s*(" + IDENTIFIER + ")");

    /**
     * {@code delete x...}. Group 1=root variable.
     */
    static final Pattern DELETE = Pattern.compile("^delete\\s+(" + IDENTIFIER + ")");

    /**
     * Local variable declaration at fragment start. Groups: 1=type head, 2=name.
     */
    static final Pattern LOCAL_DECLARATION = Pattern.compile(
        "^(" + IDENTIFIER + "(?:\\." + IDENTIFIER + ")*|mapping\\s*\\(.*\\))(?:\\s*\\[[^\\]]*\\])*"
            + "(?:\\s+(?:memory|storage|calldata|payable))*\\s+(" + IDENTIFIER + ")\\s*(?:=(?!=)|$)");

    /**
     * Control-flow prefix whose condition is skipped before classifying the rest of a fragment.
     */
    static final Pattern CONTROL_PREFIX = Pattern.compile("^(if|while|for)\\s*\\(");

    static final Pattern ELSE_PREFIX = Pattern.compile("^(else|do|unchecked|try)\\b\\s*");

    /**
     * Member headers that are recognised but not modelled.
     */
    static final Set<String> IGNORED_MEMBER_KEYWORDS = Set.of(
        "modifier", "struct", "enum", "using", "error", "type", "pragma", "import");

    static final Set<String> VISIBILITY_KEYWORDS = Set.of("public", "external", "internal", "private");

    static final Set<String> STATE_VARIABLE_MODIFIERS = Set.of(
        "public", "internal", "private", "constant", "immutable", "transient");

    /**
     * Words that can start a statement but never a local declaration's type.
     */
    static final Set<String> STATEMENT_KEYWORDS = Set.of(
        "return", "emit", "delete", "else", "new", "revert", "require", "assert", "throw", "do", "try", "catch");
}

package com.solseq.core.extractor.source;

import com.solseq.core.model.BodyEffect;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

import static com.solseq.core.extractor.source.SolidityPatterns.ASSIGNMENT_OPERATOR;
import static com.solseq.core.extractor.source.SolidityPatterns.BARE_CALL;
import static com.solseq.core.extractor.source.SolidityPatterns.CONTROL_PREFIX;
import static com.solseq.core.extractor.source.SolidityPatterns.DELETE;
import static com.solseq.core.extractor.source.SolidityPatterns.ELSE_PREFIX;
import static com.solseq.core.extractor.source.SolidityPatterns.EMIT;
import static com.solseq.core.extractor.source.SolidityPatterns.LEADING_WORD;
import static com.solseq.core.extractor.source.SolidityPatterns.LOCAL_DECLARATION;
import static com.solseq.core.extractor.source.SolidityPatterns.MEMBER_ACCESS;
import static com.solseq.core.extractor.source.SolidityPatterns.MEMBER_CALL;
import static com.solseq.core.extractor.source.SolidityPatterns.PREFIX_UPDATE;
import static com.solseq.core.extractor.source.SolidityPatterns.STATEMENT_KEYWORDS;

/**
 * Cuts a function body into statement fragments and classifies each one.
 *
 * <p>A fragment ends at {@code ;}, or at a block brace, outside parentheses. Braces that
 * belong to call options ({@code x.call{value: v}(...)}) stay inside the fragment.
 * Within one fragment effects are recorded as: member calls in text order, then the emit,
 * then the storage write. Fragments matching none of the shapes are ignored.
 */
final class SourceStatementClassifier {

    private SourceStatementClassifier() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Classifies the body between {@code start} (inclusive) and {@code end} (exclusive).
     *
     * @param text source views of the buffer
     * @param start first body offset, just after the opening brace
     * @param end body end offset, the closing brace or buffer end
     * @param stateVariables state variables visible in the function
     * @param localNames parameter and named return names
     * @param eventNames events declared by the contract
     * @return effects in source order
     */
    static List<BodyEffect> classify(SourceText text, int start, int end,
                                     Set<String> stateVariables, Set<String> localNames, Set<String> eventNames) {
        Set<String> locals = new HashSet<>(localNames);
        List<BodyEffect> effects = new ArrayList<>();
        for (int[] fragment : fragments(text, start, end)) {
            String mask = text.mask().substring(fragment[0], fragment[1]);
            String code = text.code().substring(fragment[0], fragment[1]);
            int trim = leadingWhitespace(mask);
            classifyFragment(mask.substring(trim).stripTrailing(), code.substring(trim).stripTrailing(),
                stateVariables, locals, eventNames, effects);
        }
        return effects;
    }

    private static List<int[]> fragments(SourceText text, int start, int end) {
        String mask = text.mask();
        List<int[]> fragments = new ArrayList<>();
        int fragmentStart = start;
        int parenLevel = 0;
        int i = start;
        while (i < end) {
            char c = mask.charAt(i);
            if (c == '(') {
                parenLevel++;
            } else if (c == ')' && parenLevel > 0) {
                parenLevel--;
            } else if (c == '{' && parenLevel == 0) {
                int close = text.matchingBrace(i);
                if (close > 0 && close < end && nextNonWhitespace(mask, close + 1, end) == '(') {
                    i = close + 1;
                    continue;
                }
                fragments.add(new int[] {fragmentStart, i});
                fragmentStart = i + 1;
            } else if ((c == ';' || c == '}') && parenLevel == 0) {
                // semicolons inside a for-loop header stay in the header fragment
                fragments.add(new int[] {fragmentStart, i});
                fragmentStart = i + 1;
            }
            i++;
        }
        if (fragmentStart < end) {
            fragments.add(new int[] {fragmentStart, end});
        }
        return fragments;
    }

    private static void classifyFragment(String mask, String code, Set<String> stateVariables,
                                         Set<String> locals, Set<String> eventNames, List<BodyEffect> effects) {
        if (mask.isEmpty()) {
            return;
        }

        Matcher calls = MEMBER_CALL.matcher(mask);
        while (calls.find()) {
            String receiver = calls.group(1);
            if (stateVariables.contains(receiver) && !locals.contains(receiver)) {
                int open = calls.end() - 1;
                effects.add(new BodyEffect.ExternalCall(receiver, calls.group(2), arguments(mask, code, open)));
            }
        }

        Matcher emit = EMIT.matcher(mask);
        boolean emitted = emit.find();
        if (emitted) {
            effects.add(new BodyEffect.EmitEvent(emit.group(1), arguments(mask, code, emit.end() - 1)));
        }

        int offset = statementOffset(mask);
        String statementMask = mask.substring(offset);
        String statementCode = code.substring(offset);

        Matcher bareCall = BARE_CALL.matcher(statementMask);
        if (!emitted && bareCall.find() && eventNames.contains(bareCall.group(1))) {
            effects.add(new BodyEffect.EmitEvent(bareCall.group(1), arguments(statementMask, statementCode, bareCall.end() - 1)));
        }

        String written = writtenVariable(statementMask);
        if (written != null && stateVariables.contains(written) && !locals.contains(written)) {
            effects.add(new BodyEffect.StorageWrite(written, collapse(statementCode)));
        }

        Matcher declaration = LOCAL_DECLARATION.matcher(statementMask);
        if (declaration.find() && !STATEMENT_KEYWORDS.contains(declaration.group(1))) {
            locals.add(declaration.group(2));
        }
    }

    private static String writtenVariable(String statement) {
        Matcher delete = DELETE.matcher(statement);
        if (delete.find()) {
            return delete.group(1);
        }
        Matcher prefix = PREFIX_UPDATE.matcher(statement);
        if (prefix.find()) {
            return prefix.group(1);
        }
        return assignedVariable(statement);
    }

    /**
     * Root variable of an assignment target such as {@code balances[holders[i]].amount += x}.
     * Index expressions are skipped by bracket matching, so they may nest.
     */
    private static String assignedVariable(String statement) {
        Matcher root = LEADING_WORD.matcher(statement);
        if (!root.lookingAt() || STATEMENT_KEYWORDS.contains(root.group(1))) {
            return null;
        }
        int position = root.end();
        while (true) {
            position = skipWhitespace(statement, position);
            if (position >= statement.length()) {
                return null;
            }
            char c = statement.charAt(position);
            if (c == '[') {
                int close = SourceText.matching(statement, position, '[', ']');
                if (close < 0) {
                    return null;
                }
                position = close + 1;
            } else if (c == '.') {
                Matcher member = MEMBER_ACCESS.matcher(statement).region(position, statement.length());
                if (!member.lookingAt()) {
                    return null;
                }
                position = member.end();
            } else {
                break;
            }
        }
        Matcher operator = ASSIGNMENT_OPERATOR.matcher(statement).region(position, statement.length());
        return operator.lookingAt() ? root.group(1) : null;
    }

    private static int skipWhitespace(String text, int position) {
        int i = position;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Skips {@code else}, {@code unchecked} and {@code if (...)}-style prefixes so that
     * {@code if (x) total = 0} is classified as the assignment it guards.
     */
    private static int statementOffset(String mask) {
        int offset = 0;
        boolean advanced = true;
        while (advanced && offset < mask.length()) {
            advanced = false;
            String rest = mask.substring(offset);
            Matcher elsePrefix = ELSE_PREFIX.matcher(rest);
            if (elsePrefix.find()) {
                offset += elsePrefix.end();
                advanced = true;
                continue;
            }
            Matcher control = CONTROL_PREFIX.matcher(rest);
            if (control.find()) {
                int open = offset + control.end() - 1;
                int close = SourceText.matching(mask, open, '(', ')');
                if (close < 0) {
                    return mask.length();
                }
                offset = close + 1;
                offset += leadingWhitespace(mask.substring(offset));
                advanced = true;
            }
        }
        return Math.min(offset, mask.length());
    }

    private static List<String> arguments(String mask, String code, int open) {
        int close = SourceText.matching(mask, open, '(', ')');
        if (close < 0) {
            return List.of();
        }
        return SignatureParser.splitTopLevel(code.substring(open + 1, close)).stream()
            .map(SourceStatementClassifier::collapse)
            .toList();
    }

    private static String collapse(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }

    private static int leadingWhitespace(String text) {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static char nextNonWhitespace(String text, int from, int end) {
        for (int i = from; i < end; i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return text.charAt(i);
            }
        }
        return '\0';
    }
}

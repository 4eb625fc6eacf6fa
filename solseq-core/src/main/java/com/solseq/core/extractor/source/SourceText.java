package com.solseq.core.extractor.source;

/**
 * Two offset-preserving views of a source buffer plus brace bookkeeping.
 *
 * <ul>
 *   <li>{@link #code()}: comments replaced by spaces, string literals intact. Used for
 *       text shown in the diagram.</li>
 *   <li>{@link #mask()}: comments and string literal contents replaced by spaces. Used for
 *       all structural scanning, so braces or keywords inside strings never count.</li>
 * </ul>
 *
 * <p>Newlines are kept in both views. An unterminated block comment runs to the end of
 * the buffer, an unterminated string to the end of its line.
 */
final class SourceText {

    private final String code;
    private final String mask;
    private final int[] depth;

    SourceText(String raw) {
        StringBuilder codeBuilder = new StringBuilder(raw.length());
        StringBuilder maskBuilder = new StringBuilder(raw.length());
        blank(raw, codeBuilder, maskBuilder);
        this.code = codeBuilder.toString();
        this.mask = maskBuilder.toString();
        this.depth = braceDepths(mask);
    }

    String code() {
        return code;
    }

    String mask() {
        return mask;
    }

    int length() {
        return mask.length();
    }

    /**
     * Returns the brace depth in effect before the character at {@code index}.
     */
    int depthAt(int index) {
        return depth[index];
    }

    /**
     * Finds the brace closing the one at {@code open}.
     *
     * @return index of the closing brace, or -1 when the buffer ends first
     */
    int matchingBrace(int open) {
        return matching(mask, open, '{', '}');
    }

    /**
     * Finds the parenthesis closing the one at {@code open}.
     *
     * @return index of the closing parenthesis, or -1 when the buffer ends first
     */
    int matchingParen(int open) {
        return matching(mask, open, '(', ')');
    }

    static int matching(CharSequence text, int open, char opening, char closing) {
        int level = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == opening) {
                level++;
            } else if (c == closing) {
                level--;
                if (level == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static void blank(String raw, StringBuilder code, StringBuilder mask) {
        int i = 0;
        int n = raw.length();
        while (i < n) {
            char c = raw.charAt(i);
            char next = i + 1 < n ? raw.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                while (i < n && raw.charAt(i) != '\n') {
                    code.append(' ');
                    mask.append(' ');
                    i++;
                }
            } else if (c == '/' && next == '*') {
                int end = raw.indexOf("*/", i + 2);
                int stop = end < 0 ? n : end + 2;
                for (; i < stop; i++) {
                    char blanked = raw.charAt(i) == '\n' ? '\n' : ' ';
                    code.append(blanked);
                    mask.append(blanked);
                }
            } else if (c == '"' || c == '\'') {
                code.append(c);
                mask.append(c);
                i++;
                while (i < n && raw.charAt(i) != c && raw.charAt(i) != '\n') {
                    if (raw.charAt(i) == '\\' && i + 1 < n && raw.charAt(i + 1) != '\n') {
                        code.append(raw, i, i + 2);
                        mask.append("  ");
                        i += 2;
                        continue;
                    }
                    code.append(raw.charAt(i));
                    mask.append(' ');
                    i++;
                }
                if (i < n && raw.charAt(i) == c) {
                    code.append(c);
                    mask.append(c);
                    i++;
                }
            } else {
                code.append(c);
                mask.append(c);
                i++;
            }
        }
    }

    private static int[] braceDepths(String mask) {
        int[] depths = new int[mask.length() + 1];
        int level = 0;
        for (int i = 0; i < mask.length(); i++) {
            depths[i] = level;
            char c = mask.charAt(i);
            if (c == '{') {
                level++;
            } else if (c == '}' && level > 0) {
                level--;
            }
        }
        depths[mask.length()] = level;
        return depths;
    }
}

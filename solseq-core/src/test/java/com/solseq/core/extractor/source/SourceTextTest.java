package com.solseq.core.extractor.source;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SourceText}.
 */
class SourceTextTest {

    @Test
    void views_keepOffsetsAndBlankComments() {
        String raw = "f(\"{\") /* } */ { } // {";

        SourceText text = new SourceText(raw);

        assertThat(text.code()).hasSameSizeAs(raw);
        assertThat(text.mask()).hasSameSizeAs(raw);
        assertThat(text.code()).startsWith("f(\"{\")").doesNotContain("/*").doesNotContain("//");
        assertThat(text.mask()).startsWith("f(\" \")");
    }

    @Test
    void matchingBrace_ignoresBracesInStringsAndComments() {
        String raw = "f(\"{\") /* } */ { } // {";
        SourceText text = new SourceText(raw);
        int open = raw.indexOf("{ }");

        assertThat(text.matchingBrace(open)).isEqualTo(open + 2);
    }

    @Test
    void mask_escapedQuoteDoesNotEndString() {
        String raw = "s = \"a\\\"{\"; t {";

        SourceText text = new SourceText(raw);

        assertThat(text.mask().indexOf('{')).isEqualTo(raw.lastIndexOf('{'));
        assertThat(text.code()).contains("\"a\\\"{\"");
    }

    @Test
    void depthAt_tracksNesting() {
        String raw = "a { b { c } d }";

        SourceText text = new SourceText(raw);

        assertThat(text.depthAt(raw.indexOf('a'))).isZero();
        assertThat(text.depthAt(raw.indexOf('c'))).isEqualTo(2);
        assertThat(text.depthAt(raw.indexOf('d'))).isEqualTo(1);
    }

    @Test
    void matchingBrace_unbalanced_returnsMinusOne() {
        SourceText text = new SourceText("contract A { function f() {");

        assertThat(text.matchingBrace(11)).isEqualTo(-1);
    }

    @Test
    void unterminatedBlockComment_runsToEnd() {
        String raw = "x /* {\n }";

        SourceText text = new SourceText(raw);

        assertThat(text.mask()).isEqualTo("x     \n  ");
        assertThat(text.length()).isEqualTo(raw.length());
    }

    @Test
    void matchingParen_skipsNestedParentheses() {
        String raw = "f(a, g(b), (c))";

        assertThat(new SourceText(raw).matchingParen(1)).isEqualTo(raw.length() - 1);
    }
}

package com.solseq.core.extractor.base;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for extractors that read source text with regular expressions.
 *
 * <p>Provides precompiled-pattern matching helpers. Matches are returned as immutable
 * {@link MatchResult} snapshots so they stay valid after the matcher moves on.
 *
 * <h3>When to Use This Base Class</h3>
 * <p>Use AbstractRegexExtractor when:</p>
 * <ul>
 *   <li>No compiler output is available and only raw source text can be read</li>
 *   <li>Approximate extraction is acceptable and a full grammar would be overkill</li>
 * </ul>
 *
 * @param <I> extractor input type
 * @see AbstractExtractor
 */
public abstract class AbstractRegexExtractor<I> extends AbstractExtractor<I> {

    protected AbstractRegexExtractor() {
        super();
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds all matches of a compiled pattern in the given text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return match snapshots in text order
     */
    protected List<MatchResult> findMatches(Pattern pattern, CharSequence text) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.toMatchResult());
        }
        return matches;
    }

    /**
     * Finds the first match of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return match snapshot if found, null otherwise
     */
    protected MatchResult findFirst(Pattern pattern, CharSequence text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.toMatchResult() : null;
    }

    /**
     * Checks if a pattern matches anywhere in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return true if pattern matches
     */
    protected boolean matches(Pattern pattern, CharSequence text) {
        return pattern.matcher(text).find();
    }

    /**
     * Extracts a numbered group from a match.
     *
     * @param match match snapshot
     * @param group group number
     * @return captured text, or null if the group did not participate or does not exist
     */
    protected String extractGroup(MatchResult match, int group) {
        if (match == null || group > match.groupCount()) {
            return null;
        }
        return match.group(group);
    }
}

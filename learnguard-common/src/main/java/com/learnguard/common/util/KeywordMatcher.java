package com.learnguard.common.util;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Finds whole-word occurrences of fixed phrases. A phrase matches when it is not preceded by a
 * letter or digit and, after an optional plural or verb ending, not followed by one. So "thesis"
 * matches "my thesis" but not "photosynthesis", and "learn" matches "learning".
 */
public final class KeywordMatcher {

    private static final String WORD_START = "(?<![\\p{L}\\p{N}])";
    private static final String WORD_END = "(?:s|es|ed|ing)?(?![\\p{L}\\p{N}])";

    private final List<String> phrases;
    private final List<Pattern> patterns;

    private KeywordMatcher(List<String> phrases) {
        this.phrases = phrases;
        this.patterns = phrases.stream().map(KeywordMatcher::compile).toList();
    }

    public static KeywordMatcher of(Collection<String> phrases) {
        return new KeywordMatcher(List.copyOf(phrases));
    }

    /** Phrases that occur in {@code text}, in declaration order. */
    public List<String> found(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return IntStream.range(0, phrases.size())
            .filter(i -> patterns.get(i).matcher(text).find())
            .mapToObj(phrases::get)
            .toList();
    }

    public long count(String text) {
        return found(text).size();
    }

    public boolean matchesAny(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return patterns.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    /** One-off check for phrases that are not known up front, such as parent-configured topics. */
    public static boolean containsPhrase(String text, String phrase) {
        if (text == null || phrase == null || phrase.isBlank()) {
            return false;
        }
        return compile(phrase.trim()).matcher(text).find();
    }

    private static Pattern compile(String phrase) {
        return Pattern.compile(WORD_START + Pattern.quote(phrase) + WORD_END,
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}

package com.learnguard.common.util;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonical form of a learner question, shared by cache keys and the repeated-question tracker.
 */
public final class QueryNormalizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QueryNormalizer() {}

    /**
     * Lowercase, drop punctuation, collapse whitespace, trim.
     */
    public static String normalize(String query) {
        if (query == null) {
            return "";
        }
        String lowered = query.toLowerCase(Locale.ROOT);
        String stripped = NON_WORD.matcher(lowered).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    public static Set<String> words(String query) {
        String normalized = normalize(query);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split(" "))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Jaccard similarity of the two word sets; 0 when both are empty.
     */
    public static double similarity(String a, String b) {
        Set<String> left = words(a);
        Set<String> right = words(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new LinkedHashSet<>(left);
        union.addAll(right);
        long shared = left.stream().filter(right::contains).count();
        return (double) shared / union.size();
    }
}

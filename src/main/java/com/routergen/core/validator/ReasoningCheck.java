package com.routergen.core.validator;

import com.routergen.config.ValidationPolicy;
import com.routergen.core.schema.ToolKind;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Informational threshold for reasoning traces: word count, reference to the
 * chosen variant, and no parroting of the user query.
 */
final class ReasoningCheck {

    static final int SHARED_PREFIX_LENGTH = 20;

    private ReasoningCheck() {
    }

    /** Null when the reasoning passes, otherwise the violation. */
    static String check(String reasoning, String query, ToolKind kind, ValidationPolicy policy) {
        String[] words = reasoning.trim().split("\\s+");
        int count = reasoning.isBlank() ? 0 : words.length;

        if (count < policy.getMinReasoningWords()) {
            return "reasoning has " + count + " words, minimum is " + policy.getMinReasoningWords();
        }
        if (count > policy.getMaxReasoningWords()) {
            return "reasoning has " + count + " words, maximum is " + policy.getMaxReasoningWords();
        }

        String lower = reasoning.toLowerCase(Locale.ROOT);
        boolean referencesKind = lower.contains(kind.getTag())
                || kind.getReasoningKeywords().stream().anyMatch(lower::contains);
        if (!referencesKind) {
            return "reasoning never refers to " + kind.getTag() + " (expected one of "
                    + kind.getReasoningKeywords() + ")";
        }

        double similarity = jaccard(tokens(reasoning), tokens(query));
        if (similarity >= policy.getParrotingThreshold()) {
            return String.format(Locale.ROOT, "reasoning parrots the query (word overlap %.2f)", similarity);
        }
        if (sharesPrefix(reasoning, query)) {
            return "reasoning starts by repeating the query verbatim";
        }
        return null;
    }

    static Set<String> tokens(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 1.0;
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    private static boolean sharesPrefix(String reasoning, String query) {
        String r = normalize(reasoning);
        String q = normalize(query);
        return r.length() >= SHARED_PREFIX_LENGTH
                && q.length() >= SHARED_PREFIX_LENGTH
                && r.regionMatches(0, q, 0, SHARED_PREFIX_LENGTH);
    }

    private static String normalize(String s) {
        return s.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}

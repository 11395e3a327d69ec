package com.eainde.legalqa.resolver;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Detects whether a question leans on the previous one.
 */
public class FollowUpDetector {

    private static final Pattern PRONOUN = Pattern.compile(
            "\\b(it|its|this|that|these|those|he|she|they|him|her|them|his|their)\\b");

    private static final List<String> FOLLOW_UP_PHRASES = List.of(
            "what about", "how about", "and the", "tell me more", "more details", "what else",
            "also", "furthermore", "in addition", "same case", "same one", "previous");

    private static final List<String> COMPARATIVE = List.of(
            "compare", "comparison", "difference", "different from", "similar", "versus");

    private static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "of", "in", "on", "to", "for", "and", "or", "is", "are", "was", "were",
            "what", "who", "how", "why", "when", "which", "does", "did", "do", "can", "about", "with");

    private static final int INCOMPLETE_MAX_WORDS = 4;

    private final double overlapThreshold;

    public FollowUpDetector(double overlapThreshold) {
        this.overlapThreshold = overlapThreshold;
    }

    /**
     * Indicator labels found in {@code query}: {@code pronoun_reference}, {@code follow_up_phrase},
     * {@code incomplete_question}, {@code comparative_question}.
     */
    public List<String> indicators(String query) {
        List<String> found = new ArrayList<>();
        if (query == null || query.isBlank()) {
            return found;
        }
        String lower = query.toLowerCase(Locale.ROOT);
        if (PRONOUN.matcher(lower).find()) found.add("pronoun_reference");
        if (FOLLOW_UP_PHRASES.stream().anyMatch(lower::contains)) found.add("follow_up_phrase");
        if (lower.trim().split("\\s+").length <= INCOMPLETE_MAX_WORDS) found.add("incomplete_question");
        if (COMPARATIVE.stream().anyMatch(lower::contains)) found.add("comparative_question");
        return found;
    }

    /**
     * Related follow-up: a pronoun is present, or the content-word Jaccard overlap with the
     * previous question reaches the threshold.
     */
    public boolean isRelatedFollowUp(String query, String previousQuery) {
        if (previousQuery == null || previousQuery.isBlank() || query == null) {
            return false;
        }
        if (PRONOUN.matcher(query.toLowerCase(Locale.ROOT)).find()) {
            return true;
        }
        return overlap(query, previousQuery) >= overlapThreshold;
    }

    static double overlap(String a, String b) {
        Set<String> left = contentWords(a);
        Set<String> right = contentWords(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        left.retainAll(right);
        return (double) left.size() / union.size();
    }

    private static Set<String> contentWords(String text) {
        Set<String> words = new HashSet<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9/]+")) {
            if (token.length() > 1 && !STOPWORDS.contains(token)) {
                words.add(token);
            }
        }
        return words;
    }
}

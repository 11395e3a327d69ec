package com.eainde.legalqa.resolver;

import java.util.List;
import java.util.Locale;

/**
 * Flags questions that must never inherit a case lock.
 */
public final class QueryIntentDetector {

    private static final List<String> PROCEDURAL = List.of(
            "how to", "how do i", "how can i", "procedure", "process for", "steps", "file a", "filing",
            "requirements for");

    private static final List<String> OPINION = List.of(
            "what do you think", "your opinion", "in your view", "do you believe", "what is your view");

    private QueryIntentDetector() {
    }

    public static boolean isProcedural(String query) {
        return containsAny(query, PROCEDURAL);
    }

    public static boolean isGeneralOpinion(String query) {
        return containsAny(query, OPINION);
    }

    private static boolean containsAny(String query, List<String> cues) {
        if (query == null) {
            return false;
        }
        String lower = query.toLowerCase(Locale.ROOT);
        return cues.stream().anyMatch(lower::contains);
    }
}

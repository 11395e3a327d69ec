package com.eainde.legalqa.conversation;

import com.eainde.legalqa.model.ActiveCaseContext;
import com.eainde.legalqa.model.ConversationTurn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the short rolling summary the case resolver reasons over.
 *
 * <pre>
 * Active case: C.P. 12/2021 Civil. Recent questions: who are the advocates? | what was the order?.
 * Topics: advocates, court order.
 * </pre>
 *
 * <p>Deterministic: same turns and case always produce the same text.</p>
 */
public class ConversationSummarizer {

    public static final String NO_PRIOR_CONVERSATION = "No prior conversation.";

    private static final int QUERY_EXCERPT_CHARS = 120;

    /** Topic tag to trigger keywords, in output order. */
    private static final Map<String, List<String>> TOPICS = new LinkedHashMap<>();

    static {
        TOPICS.put("summary", List.of("summary", "summarize", "overview", "brief"));
        TOPICS.put("advocates", List.of("advocate", "lawyer", "counsel"));
        TOPICS.put("court order", List.of("order", "directed"));
        TOPICS.put("fir info", List.of("fir", "first information report"));
    }

    private final int maxTurns;
    private final int maxWords;

    public ConversationSummarizer(int maxTurns, int maxWords) {
        this.maxTurns = maxTurns;
        this.maxWords = maxWords;
    }

    public String summarize(List<ConversationTurn> turns, ActiveCaseContext activeCase) {
        String caseRef = activeCase == null ? null : activeCase.displayReference();
        if (turns == null || turns.isEmpty()) {
            return caseRef != null ? "User is discussing case " + caseRef + "." : NO_PRIOR_CONVERSATION;
        }

        List<ConversationTurn> window = turns.subList(Math.max(0, turns.size() - maxTurns), turns.size());
        List<String> parts = new ArrayList<>();
        if (caseRef != null) {
            parts.add("Active case: " + caseRef);
        }

        List<String> excerpts = new ArrayList<>();
        StringBuilder corpus = new StringBuilder();
        for (ConversationTurn turn : window) {
            String q = turn.query() == null ? "" : turn.query().trim();
            excerpts.add(q.length() > QUERY_EXCERPT_CHARS ? q.substring(0, QUERY_EXCERPT_CHARS) : q);
            corpus.append(q).append(' ');
        }
        parts.add("Recent questions: " + String.join(" | ", excerpts));

        List<String> topics = detectTopics(corpus.toString());
        if (!topics.isEmpty()) {
            parts.add("Topics: " + String.join(", ", topics));
        }
        return capWords(String.join(". ", parts) + ".");
    }

    /**
     * Whether {@code summary} carries real content rather than the empty placeholder.
     */
    public static boolean isInformative(String summary) {
        return summary != null && !summary.isBlank() && !NO_PRIOR_CONVERSATION.equals(summary);
    }

    static List<String> detectTopics(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        for (Map.Entry<String, List<String>> topic : TOPICS.entrySet()) {
            for (String keyword : topic.getValue()) {
                if (lower.matches("(?s).*\\b" + keyword + "s?\\b.*")) {
                    found.add(topic.getKey());
                    break;
                }
            }
        }
        return found;
    }

    private String capWords(String text) {
        String[] words = text.split("\\s+");
        if (words.length <= maxWords) {
            return text;
        }
        return String.join(" ", Arrays.copyOf(words, maxWords)) + "...";
    }
}

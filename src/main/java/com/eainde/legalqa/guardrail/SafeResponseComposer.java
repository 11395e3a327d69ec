package com.eainde.legalqa.guardrail;

/**
 * Fallback text shown instead of a denied answer.
 */
public final class SafeResponseComposer {

    public static final String DISCLAIMER = "Please note: This is legal information, not legal advice. "
            + "Always consult with a qualified legal professional for specific legal matters.";

    private static final int TOPIC_CHARS = 100;

    private SafeResponseComposer() {
    }

    /**
     * Acknowledges the topic, states how many sources were found and appends {@link #DISCLAIMER}.
     */
    public static String compose(String query, int sourceCount) {
        StringBuilder sb = new StringBuilder("I understand you're asking about ")
                .append(topic(query)).append(". ");
        if (sourceCount > 0) {
            sb.append("I found ").append(sourceCount).append(" relevant legal document")
                    .append(sourceCount == 1 ? "" : "s")
                    .append(" that may be helpful for your research, but I cannot provide a reliable answer "
                            + "to this specific question. ")
                    .append("I recommend consulting with a qualified legal professional who can give advice "
                            + "based on your specific situation.");
        } else {
            sb.append("I couldn't find specific information about your question in the current legal database. ")
                    .append("I recommend consulting with a qualified legal professional for accurate and "
                            + "personalized legal guidance.");
        }
        return sb.append("\n\n").append(DISCLAIMER).toString();
    }

    /**
     * Text for a question rejected before retrieval.
     */
    public static String refusal(String reason) {
        return "I'm unable to help with this request (" + reason + "). "
                + "If you have a legal question, please rephrase it or consult a qualified legal professional."
                + "\n\n" + DISCLAIMER;
    }

    private static String topic(String query) {
        if (query == null || query.isBlank()) {
            return "a legal matter";
        }
        String q = query.trim().replaceAll("\\s+", " ");
        if (q.length() > TOPIC_CHARS) {
            q = q.substring(0, TOPIC_CHARS).trim() + "...";
        }
        return "\"" + q + "\"";
    }
}

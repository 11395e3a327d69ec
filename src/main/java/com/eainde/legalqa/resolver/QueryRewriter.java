package com.eainde.legalqa.resolver;

import com.eainde.legalqa.conversation.ConversationSummarizer;
import com.eainde.legalqa.model.ActiveCaseContext;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Produces the standalone retrieval query.
 *
 * <ol>
 *   <li>With a case lock: pronoun phrases ("this case", "that matter", "same one") are replaced
 *       by the case reference; short questions using "it" get the reference appended.</li>
 *   <li>Without a lock, for follow-ups: a short summary fragment is appended in parentheses.</li>
 *   <li>Last resort for follow-ups: {@code "<previous question> THEN: <question>"}.</li>
 * </ol>
 * Whitespace is collapsed and the result is capped at {@code maxChars}.
 */
public class QueryRewriter {

    static final String THEN_SEPARATOR = " THEN: ";

    private static final Pattern CASE_PRONOUN = Pattern.compile(
            "\\b(?:this|that|the same|said)\\s+(?:case|matter)\\b|\\bsame one\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern IT = Pattern.compile("\\bit\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final int SHORT_QUERY_WORDS = 8;
    private static final int SUMMARY_FRAGMENT_CHARS = 120;

    private final int maxChars;

    public QueryRewriter(int maxChars) {
        this.maxChars = maxChars;
    }

    /**
     * @param query        the question as asked
     * @param activeCase   case lock after resolution, or {@code null}
     * @param summary      rolling summary
     * @param previousQuery previous question, or {@code null}
     * @param followUp     whether the question leans on the previous one
     */
    public String rewrite(String query, ActiveCaseContext activeCase, String summary,
                          String previousQuery, boolean followUp) {
        String q = collapse(query);
        if (q.isEmpty()) {
            return q;
        }

        if (activeCase != null && activeCase.displayReference() != null) {
            return cap(withCase(q, activeCase.displayReference()));
        }

        if (!followUp) {
            return cap(q);
        }
        if (ConversationSummarizer.isInformative(summary)) {
            return cap(q + " (context: " + fragment(summary) + ")");
        }
        if (previousQuery != null && !previousQuery.isBlank()) {
            return cap(collapse(previousQuery) + THEN_SEPARATOR + q);
        }
        return cap(q);
    }

    String withCase(String query, String caseRef) {
        Matcher m = CASE_PRONOUN.matcher(query);
        if (m.find()) {
            return m.replaceAll(Matcher.quoteReplacement(caseRef));
        }
        boolean mentionsCase = query.toLowerCase(Locale.ROOT).contains(caseRef.toLowerCase(Locale.ROOT));
        if (!mentionsCase && IT.matcher(query).find() && wordCount(query) <= SHORT_QUERY_WORDS) {
            return query + " (" + caseRef + ")";
        }
        return query;
    }

    private static String fragment(String summary) {
        return truncate(collapse(summary), SUMMARY_FRAGMENT_CHARS);
    }

    private String cap(String text) {
        return truncate(collapse(text), maxChars);
    }

    /** Cuts to at most {@code limit} chars without splitting a surrogate pair. */
    static String truncate(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        int end = limit;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end).trim();
    }

    private static String collapse(String text) {
        return text == null ? "" : WHITESPACE.matcher(text.trim()).replaceAll(" ");
    }

    private static int wordCount(String text) {
        return text.isBlank() ? 0 : text.trim().split("\\s+").length;
    }
}

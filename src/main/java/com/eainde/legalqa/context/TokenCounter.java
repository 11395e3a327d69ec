package com.eainde.legalqa.context;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingResult;
import com.knuddels.jtokkit.api.EncodingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts and truncates text in tokens.
 *
 * <p>Uses the cl100k_base encoding when it is requested and loads; otherwise every count is
 * estimated as {@code length / 4}. The mode is fixed at construction so counting and truncation
 * agree for the lifetime of the instance.</p>
 */
public class TokenCounter {

    private static final Logger log = LoggerFactory.getLogger(TokenCounter.class);

    static final int CHARS_PER_TOKEN = 4;

    /** Whitespace back-off only applies when it keeps at least this share of the budget. */
    private static final double MIN_KEEP_RATIO = 0.8;

    private static final String ELLIPSIS = "...";

    private final Encoding encoding;

    public TokenCounter(boolean exact) {
        this.encoding = exact ? loadEncoding() : null;
    }

    public static TokenCounter estimating() {
        return new TokenCounter(false);
    }

    public boolean isExact() {
        return encoding != null;
    }

    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        if (encoding != null) {
            return encoding.countTokens(text);
        }
        return text.length() / CHARS_PER_TOKEN;
    }

    /**
     * Cuts {@code text} to at most {@code maxTokens} tokens.
     *
     * <p>In exact mode the cut is made on a token boundary. In estimating mode the text is cut
     * at {@code maxTokens * 4} characters, backing off to the last whitespace when that keeps at
     * least 80% of the budget. An ellipsis is appended in both modes when anything was cut.</p>
     */
    public String truncate(String text, int maxTokens) {
        if (text == null || text.isEmpty() || count(text) <= maxTokens) {
            return text;
        }
        if (encoding != null) {
            EncodingResult result = encoding.encodeOrdinary(text, Math.max(0, maxTokens - 1));
            return encoding.decode(result.getTokens()).stripTrailing() + ELLIPSIS;
        }
        int budget = Math.max(0, maxTokens * CHARS_PER_TOKEN - ELLIPSIS.length());
        String cut = text.substring(0, Math.min(budget, text.length()));
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > budget * MIN_KEEP_RATIO) {
            cut = cut.substring(0, lastSpace);
        }
        return cut.stripTrailing() + ELLIPSIS;
    }

    private static Encoding loadEncoding() {
        try {
            return Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
        } catch (RuntimeException e) {
            log.warn("cl100k_base encoding unavailable, falling back to length/4 estimate: {}", e.getMessage());
            return null;
        }
    }
}

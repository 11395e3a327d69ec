package com.eainde.legalqa.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Final touches on a generated answer: softer wording for categorical advice and tidy whitespace.
 */
public class AnswerPostProcessor {

    private static final Map<Pattern, String> SOFTENINGS = new LinkedHashMap<>();

    static {
        SOFTENINGS.put(Pattern.compile("\\bI guarantee( that)?\\s+", Pattern.CASE_INSENSITIVE), "Generally, ");
        SOFTENINGS.put(Pattern.compile("\\byou will definitely win\\b", Pattern.CASE_INSENSITIVE), "you may have a strong case");
        SOFTENINGS.put(Pattern.compile("\\byou will definitely lose\\b", Pattern.CASE_INSENSITIVE), "your case may face difficulties");
        SOFTENINGS.put(Pattern.compile("\\byou must\\b"), "you may need to");
        SOFTENINGS.put(Pattern.compile("\\bYou must\\b"), "You may need to");
    }

    private static final Pattern TRAILING_SPACES = Pattern.compile("[ \\t]+(?=\\n)");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    public String process(String answer) {
        if (answer == null) {
            return null;
        }
        String text = answer;
        for (Map.Entry<Pattern, String> softening : SOFTENINGS.entrySet()) {
            text = softening.getKey().matcher(text).replaceAll(softening.getValue());
        }
        text = TRAILING_SPACES.matcher(text).replaceAll("");
        text = EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.strip();
    }
}

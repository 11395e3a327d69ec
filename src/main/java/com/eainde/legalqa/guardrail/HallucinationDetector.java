package com.eainde.legalqa.guardrail;

import com.eainde.legalqa.model.SourceReference;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic hallucination risk for a generated answer.
 *
 * <table>
 *   <caption>Score contributions</caption>
 *   <tr><td>uncertainty phrase</td><td>+0.1 each</td></tr>
 *   <tr><td>absolute claim, no source case number in the answer</td><td>+0.2 each</td></tr>
 *   <tr><td>contradictory pair present</td><td>+0.3 each</td></tr>
 *   <tr><td>citation not found in any source</td><td>+0.4 each</td></tr>
 *   <tr><td>overconfident phrase with fewer than 2 sources</td><td>+0.2 each</td></tr>
 * </table>
 * The total is clamped to [0,1]. Words are matched on word boundaries.
 */
public class HallucinationDetector {

    public static final double HIGH_RISK = 0.5;

    static final List<String> UNCERTAINTY = List.of(
            "according to my knowledge", "i believe", "i think", "it seems", "probably",
            "maybe", "perhaps", "i assume", "i guess", "i suppose");

    static final List<String> ABSOLUTES = List.of(
            "always", "never", "all", "every", "none", "no one",
            "definitely", "certainly", "absolutely", "without exception");

    static final List<String[]> CONTRADICTIONS = List.of(
            new String[]{"always", "never"},
            new String[]{"all", "none"},
            new String[]{"every", "no"},
            new String[]{"definitely", "maybe"},
            new String[]{"certainly", "perhaps"});

    static final List<String> OVERCONFIDENT = List.of(
            "this is definitely", "this is certainly", "this is absolutely",
            "without a doubt", "it is clear that", "it is obvious that",
            "there is no question", "it is certain that");

    static final Pattern CITATION = Pattern.compile(
            "\\b(?:PLD\\s+\\d{4}\\s+[A-Z]{2,3}\\s+\\d+|(?:PLJ|MLD|CLC|SCMR|YLR)\\s+\\d{4}\\s+\\d+)\\b",
            Pattern.CASE_INSENSITIVE);

    /**
     * @param score    clamped risk in [0,1]
     * @param findings human readable reasons
     */
    public record Assessment(double score, List<String> findings) {
        public boolean isHighRisk() {
            return score > HIGH_RISK;
        }
    }

    public Assessment assess(String answer, List<SourceReference> sources) {
        String lower = answer == null ? "" : answer.toLowerCase(Locale.ROOT);
        List<String> findings = new ArrayList<>();
        double score = 0.0;

        for (String phrase : UNCERTAINTY) {
            if (containsWord(lower, phrase)) {
                findings.add("Uncertainty phrase: '" + phrase + "'");
                score += 0.1;
            }
        }

        boolean citesSourceCase = sources.stream()
                .anyMatch(s -> s.caseNumber() != null && lower.contains(s.caseNumber().toLowerCase(Locale.ROOT)));
        if (!citesSourceCase) {
            for (String word : ABSOLUTES) {
                if (containsWord(lower, word)) {
                    findings.add("Absolute claim without citation: '" + word + "'");
                    score += 0.2;
                }
            }
        }

        for (String[] pair : CONTRADICTIONS) {
            if (containsWord(lower, pair[0]) && containsWord(lower, pair[1])) {
                findings.add("Contradictory terms: '" + pair[0] + "' and '" + pair[1] + "'");
                score += 0.3;
            }
        }

        for (String citation : unsupportedCitations(answer, sources)) {
            findings.add("Citation not found in sources: " + citation);
            score += 0.4;
        }

        if (sources.size() < 2) {
            for (String phrase : OVERCONFIDENT) {
                if (lower.contains(phrase)) {
                    findings.add("Overconfident without support: '" + phrase + "'");
                    score += 0.2;
                }
            }
        }

        return new Assessment(Math.min(1.0, score), findings);
    }

    static List<String> unsupportedCitations(String answer, List<SourceReference> sources) {
        if (answer == null) {
            return List.of();
        }
        Set<String> unsupported = new LinkedHashSet<>();
        Matcher m = CITATION.matcher(answer);
        while (m.find()) {
            String citation = m.group().replaceAll("\\s+", " ");
            String needle = citation.toLowerCase(Locale.ROOT);
            boolean found = sources.stream().anyMatch(s -> sourceText(s).contains(needle));
            if (!found) {
                unsupported.add(citation);
            }
        }
        return new ArrayList<>(unsupported);
    }

    private static String sourceText(SourceReference source) {
        return String.join(" ",
                String.valueOf(source.citation()),
                String.valueOf(source.title()),
                String.valueOf(source.caseNumber())).toLowerCase(Locale.ROOT);
    }

    private static boolean containsWord(String lower, String phrase) {
        return Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b").matcher(lower).find();
    }
}

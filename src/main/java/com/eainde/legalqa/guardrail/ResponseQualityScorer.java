package com.eainde.legalqa.guardrail;

import com.eainde.legalqa.model.QualityMetrics;
import com.eainde.legalqa.model.SourceReference;

import java.util.List;
import java.util.Locale;

/**
 * Scores an answer against the sources it was generated from.
 *
 * <pre>
 * overall = 0.25 relevance + 0.20 completeness + 0.25 accuracy + 0.15 citation + 0.15 legal
 * </pre>
 */
public class ResponseQualityScorer {

    static final double W_RELEVANCE = 0.25;
    static final double W_COMPLETENESS = 0.20;
    static final double W_ACCURACY = 0.25;
    static final double W_CITATION = 0.15;
    static final double W_LEGAL = 0.15;

    static final List<String> CITATION_INDICATORS = List.of(
            "case number", "court", "date", "judge", "section", "article",
            "plj", "pld", "mld", "clc", "scmr", "ylr");

    static final List<String> LEGAL_TERMS = List.of(
            "court", "judgment", "order", "section", "article", "act", "code",
            "constitution", "statute", "precedent", "jurisdiction", "appeal",
            "bail", "writ", "petition", "plaintiff", "defendant", "respondent");

    public QualityMetrics score(String answer, List<SourceReference> sources) {
        String text = answer == null ? "" : answer;
        String lower = text.toLowerCase(Locale.ROOT);

        double relevance = relevance(lower, sources);
        double completeness = completeness(text, lower);
        double accuracy = accuracy(sources);
        double citation = citationQuality(lower, sources);
        double legal = legalAccuracy(lower);

        double overall = relevance * W_RELEVANCE
                + completeness * W_COMPLETENESS
                + accuracy * W_ACCURACY
                + citation * W_CITATION
                + legal * W_LEGAL;
        return new QualityMetrics(relevance, completeness, accuracy, citation, legal, overall);
    }

    /**
     * Case number, court and judge mentions of each source, divided by the source count.
     */
    static double relevance(String lower, List<SourceReference> sources) {
        if (sources.isEmpty()) {
            return 0.0;
        }
        int references = 0;
        for (SourceReference source : sources) {
            if (mentions(lower, source.caseNumber())) references++;
            if (mentions(lower, source.court())) references++;
            if (mentions(lower, source.judgeName())) references++;
        }
        return Math.min(1.0, (double) references / sources.size());
    }

    static double completeness(String text, String lower) {
        double score = 0.5;
        if (text.length() > 500) {
            score += 0.2;
        } else if (text.length() > 200) {
            score += 0.1;
        }
        if (text.contains("1.") && text.contains("2.")) score += 0.1;
        if (lower.contains("based on") || lower.contains("according to")) score += 0.1;
        if (lower.contains("however") || lower.contains("furthermore")) score += 0.1;
        return Math.min(1.0, score);
    }

    /**
     * Average reliability of the source types: court decisions 0.9, statutory text and case
     * metadata 0.8, anything else 0.7. 0.5 without sources.
     */
    static double accuracy(List<SourceReference> sources) {
        if (sources.isEmpty()) {
            return 0.5;
        }
        double sum = 0;
        for (SourceReference source : sources) {
            if (source.sourceType() == null) {
                sum += 0.7;
                continue;
            }
            sum += switch (source.sourceType()) {
                case JUDGMENT, ORDER -> 0.9;
                case CASE_METADATA, STATUTE, CONSTITUTIONAL_ARTICLE -> 0.8;
                default -> 0.7;
            };
        }
        return sum / sources.size();
    }

    static double citationQuality(String lower, List<SourceReference> sources) {
        if (sources.isEmpty()) {
            return 0.0;
        }
        long indicators = CITATION_INDICATORS.stream().filter(lower::contains).count();
        long references = sources.stream().filter(s -> mentions(lower, s.caseNumber())).count();
        double score = (double) (indicators + references) / (CITATION_INDICATORS.size() + sources.size());
        return Math.min(1.0, score);
    }

    static double legalAccuracy(String lower) {
        double score = 0.7;
        long terms = LEGAL_TERMS.stream().filter(lower::contains).count();
        if (terms > 5) {
            score += 0.2;
        } else if (terms > 3) {
            score += 0.1;
        }
        if (lower.contains("based on") || lower.contains("according to")) {
            score += 0.1;
        }
        return Math.min(1.0, score);
    }

    private static boolean mentions(String lowerAnswer, String value) {
        return value != null && !value.isBlank() && lowerAnswer.contains(value.toLowerCase(Locale.ROOT));
    }
}

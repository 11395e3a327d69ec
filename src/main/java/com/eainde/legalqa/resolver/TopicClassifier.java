package com.eainde.legalqa.resolver;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a question stays on the active case or moves to a new one.
 *
 * <p>Biased toward {@link Topic#SAME}: {@link Topic#NEW} is returned only for an explicit
 * "new topic" phrase, or for a case marker ({@code vs}, {@code /}, case-type abbreviations)
 * when the active case number does not appear in the question.</p>
 */
@Slf4j
public class TopicClassifier {

    public enum Topic { SAME, NEW }

    private static final List<String> CASE_MARKERS = List.of(
            " vs ", " v. ", " versus ", "/", " crl ", " crim ", " misc ", " writ ", " ta ", " c.o. ");

    private static final List<String> NEW_TOPIC_PHRASES = List.of(
            "new query", "new question", "another case", "different case", "switch case", "move to",
            "unrelated question", "change topic");

    public Topic classify(String summary, String query, String activeCaseNumber) {
        if (query == null || query.isBlank()) {
            return Topic.SAME;
        }
        String padded = " " + query.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ") + " ";

        for (String phrase : NEW_TOPIC_PHRASES) {
            if (padded.contains(phrase)) {
                log.debug("Topic NEW: phrase '{}'", phrase);
                return Topic.NEW;
            }
        }

        boolean hasMarker = CASE_MARKERS.stream().anyMatch(padded::contains);
        if (!hasMarker) {
            return Topic.SAME;
        }
        if (activeCaseNumber != null && !activeCaseNumber.isBlank()
                && CaseReferenceExtractor.normalize(padded).contains(CaseReferenceExtractor.normalize(activeCaseNumber))) {
            return Topic.SAME;
        }
        log.debug("Topic NEW: case marker without active case '{}' (summary: {})", activeCaseNumber, summary);
        return Topic.NEW;
    }
}

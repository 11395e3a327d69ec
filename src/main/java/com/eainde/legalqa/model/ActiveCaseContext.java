package com.eainde.legalqa.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * The case a session is currently locked to. At most one per session.
 *
 * @param caseId               resolved case identifier
 * @param caseNumber           court case number
 * @param caseTitle            parties line, e.g. "A vs B"
 * @param court                court name
 * @param bench                bench or judge composition
 * @param status               case status as reported by the source
 * @param petitionerAdvocates  advocates for the petitioner side
 * @param respondentAdvocates  advocates for the respondent side
 * @param shortOrder           short order text
 * @param summary              case summary
 * @param sources              passages the lock was derived from
 * @param lockedAt             when the lock was taken
 */
public record ActiveCaseContext(
        @JsonProperty("caseId")              String caseId,
        @JsonProperty("caseNumber")          String caseNumber,
        @JsonProperty("caseTitle")           String caseTitle,
        @JsonProperty("court")               String court,
        @JsonProperty("bench")               String bench,
        @JsonProperty("status")              String status,
        @JsonProperty("petitionerAdvocates") List<String> petitionerAdvocates,
        @JsonProperty("respondentAdvocates") List<String> respondentAdvocates,
        @JsonProperty("shortOrder")          String shortOrder,
        @JsonProperty("summary")             String summary,
        @JsonProperty("sources")             List<SourceReference> sources,
        @JsonProperty("lockedAt")            Instant lockedAt
) {

    public ActiveCaseContext {
        petitionerAdvocates = petitionerAdvocates == null ? List.of() : List.copyOf(petitionerAdvocates);
        respondentAdvocates = respondentAdvocates == null ? List.of() : List.copyOf(respondentAdvocates);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    /**
     * Best label for substitution into a query: case number, else title, else id.
     */
    public String displayReference() {
        if (caseNumber != null && !caseNumber.isBlank()) {
            return caseNumber;
        }
        if (caseTitle != null && !caseTitle.isBlank()) {
            return caseTitle;
        }
        return caseId;
    }
}

package com.eainde.legalqa.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One question/answer exchange. Turns are append-only.
 *
 * @param sessionId       owning session
 * @param sequence        1-based position in the session
 * @param query           the question as asked
 * @param standaloneQuery the rewritten query used for retrieval
 * @param answer          the answer returned to the user
 * @param status          terminal status of the exchange
 * @param confidence      answer confidence in [0,1]
 * @param caseId          case the turn was locked to, or {@code null}
 * @param sources         cited sources
 * @param createdAt       when the turn was recorded
 */
public record ConversationTurn(
        @JsonProperty("sessionId")       String sessionId,
        @JsonProperty("sequence")        int sequence,
        @JsonProperty("query")           String query,
        @JsonProperty("standaloneQuery") String standaloneQuery,
        @JsonProperty("answer")          String answer,
        @JsonProperty("status")          AnswerStatus status,
        @JsonProperty("confidence")      double confidence,
        @JsonProperty("caseId")          String caseId,
        @JsonProperty("sources")         List<SourceReference> sources,
        @JsonProperty("createdAt")       Instant createdAt
) {

    public ConversationTurn {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public ConversationTurn withSequence(int sequence) {
        return new ConversationTurn(sessionId, sequence, query, standaloneQuery, answer, status, confidence,
                caseId, sources, createdAt);
    }
}

package com.eainde.legalqa.pipeline;

import com.eainde.legalqa.model.AnswerStatus;
import com.eainde.legalqa.model.GuardrailVerdict;
import com.eainde.legalqa.model.SourceReference;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * What the front end receives for one question.
 *
 * @param answerText       answer, safe fallback or user-facing error message
 * @param confidence       generator confidence, 0 for anything but a delivered answer
 * @param sources          formatted citations of the passages the answer was built from
 * @param status           terminal status
 * @param metadata         stage timings, classification, packing and lock details
 * @param sessionId        session the exchange belongs to
 * @param guardrailVerdict last guardrail verdict, {@code null} when no check ran
 */
public record AnswerResult(
        @JsonProperty("answerText")       String answerText,
        @JsonProperty("confidence")       double confidence,
        @JsonProperty("sources")          List<SourceReference> sources,
        @JsonProperty("status")           AnswerStatus status,
        @JsonProperty("metadata")         Map<String, Object> metadata,
        @JsonProperty("sessionId")        String sessionId,
        @JsonProperty("guardrailVerdict") GuardrailVerdict guardrailVerdict
) {

    public AnswerResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
        metadata = metadata == null ? Map.of() : metadata;
    }

    /**
     * Result with no answer, confidence 0 and no sources.
     */
    public static AnswerResult terminal(AnswerStatus status, String message, String sessionId,
                                        Map<String, Object> metadata, GuardrailVerdict verdict) {
        return new AnswerResult(message, 0.0, List.of(), status, metadata, sessionId, verdict);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == AnswerStatus.SUCCESS;
    }
}

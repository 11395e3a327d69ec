package com.eainde.legalqa.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a guardrail checkpoint. A verdict with errors is never allowed.
 *
 * @param allowed             whether the query or answer may proceed
 * @param riskLevel           assessed risk
 * @param warnings            non-blocking findings
 * @param errors              blocking findings
 * @param safeResponse        fallback text to show instead of the answer, when denied
 * @param quality             response quality; {@link QualityMetrics#none()} for query checks
 * @param confidenceThreshold minimum confidence required at this risk level
 * @param requiredAccess      access level needed for this query
 * @param hallucinationScore  hallucination risk in [0,1]; 0 for query checks
 * @param riskFactors         short labels of what raised the risk
 */
public record GuardrailVerdict(
        @JsonProperty("allowed")             boolean allowed,
        @JsonProperty("riskLevel")           RiskLevel riskLevel,
        @JsonProperty("warnings")            List<String> warnings,
        @JsonProperty("errors")              List<String> errors,
        @JsonProperty("safeResponse")        String safeResponse,
        @JsonProperty("quality")             QualityMetrics quality,
        @JsonProperty("confidenceThreshold") double confidenceThreshold,
        @JsonProperty("requiredAccess")      AccessLevel requiredAccess,
        @JsonProperty("hallucinationScore")  double hallucinationScore,
        @JsonProperty("riskFactors")         List<String> riskFactors
) {

    public GuardrailVerdict {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        quality = quality == null ? QualityMetrics.none() : quality;
        allowed = allowed && errors.isEmpty();
    }

    /**
     * Verdict used when guardrails are switched off.
     */
    public static GuardrailVerdict pass() {
        return new GuardrailVerdict(true, RiskLevel.LOW, List.of(), List.of(), null,
                QualityMetrics.none(), 0.0, AccessLevel.PUBLIC, 0.0, List.of());
    }
}

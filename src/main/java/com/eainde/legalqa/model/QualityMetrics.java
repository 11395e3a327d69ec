package com.eainde.legalqa.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response quality sub-scores, each in [0,1].
 */
public record QualityMetrics(
        @JsonProperty("relevance")       double relevance,
        @JsonProperty("completeness")    double completeness,
        @JsonProperty("accuracy")        double accuracy,
        @JsonProperty("citationQuality") double citationQuality,
        @JsonProperty("legalAccuracy")   double legalAccuracy,
        @JsonProperty("overall")         double overall
) {

    public static QualityMetrics none() {
        return new QualityMetrics(0, 0, 0, 0, 0, 0);
    }
}

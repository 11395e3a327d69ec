package com.eainde.legalqa.generation;

/**
 * Confidence for a generated answer when the model supplies none.
 *
 * <pre>
 * base
 *   + 0.05 if text longer than 200 chars, - 0.10 if shorter than 50
 *   + 0.05 if chars per output token above 0.5, - 0.05 if below 0.3
 * clamped to [0,1]
 * </pre>
 */
public class ConfidenceEstimator {

    private final double baseConfidence;

    public ConfidenceEstimator(double baseConfidence) {
        this.baseConfidence = baseConfidence;
    }

    public double estimate(String text, int tokensUsed) {
        String t = text == null ? "" : text;
        double confidence = baseConfidence;
        if (t.length() > 200) {
            confidence += 0.05;
        } else if (t.length() < 50) {
            confidence -= 0.1;
        }
        if (tokensUsed > 0) {
            double efficiency = (double) t.length() / tokensUsed;
            if (efficiency > 0.5) {
                confidence += 0.05;
            } else if (efficiency < 0.3) {
                confidence -= 0.05;
            }
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}

package com.eainde.legalqa.generation;

/**
 * Outcome of one generator call.
 *
 * @param text       generated answer, empty on failure
 * @param confidence confidence in [0,1], 0 on failure
 * @param tokensUsed total tokens reported (or estimated) for the call
 * @param status     {@code SUCCESS} or {@code ERROR}
 * @param error      failure description, {@code null} on success
 */
public record GenerationResult(
        String text,
        double confidence,
        int tokensUsed,
        Status status,
        String error
) {

    public enum Status { SUCCESS, ERROR }

    public static GenerationResult success(String text, double confidence, int tokensUsed) {
        return new GenerationResult(text, confidence, tokensUsed, Status.SUCCESS, null);
    }

    public static GenerationResult failure(String error) {
        return new GenerationResult("", 0.0, 0, Status.ERROR, error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}

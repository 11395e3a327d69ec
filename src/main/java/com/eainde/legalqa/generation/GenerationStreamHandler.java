package com.eainde.legalqa.generation;

/**
 * Receives a streamed generation: zero or more increments, then exactly one of
 * {@link #onComplete} or {@link #onError}.
 */
public interface GenerationStreamHandler {

    void onContent(String increment);

    void onComplete(GenerationResult result);

    void onError(Throwable error);
}

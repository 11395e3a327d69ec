package com.eainde.legalqa.pipeline;

/**
 * Receives the events of a streamed answer.
 */
@FunctionalInterface
public interface StreamObserver {

    void onChunk(StreamChunk chunk);
}

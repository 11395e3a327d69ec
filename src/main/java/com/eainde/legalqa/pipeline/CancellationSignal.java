package com.eainde.legalqa.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Set by the caller when it abandons a streamed request. Once cancelled, no further increments
 * are forwarded and the exchange is not stored.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

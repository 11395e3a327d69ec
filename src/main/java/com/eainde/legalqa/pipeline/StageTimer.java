package com.eainde.legalqa.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Wall-clock milliseconds per pipeline stage, in execution order.
 */
class StageTimer {

    private final long startNanos = System.nanoTime();
    private final Map<String, Long> stages = new LinkedHashMap<>();

    <T> T time(String stage, Supplier<T> work) {
        long t0 = System.nanoTime();
        try {
            return work.get();
        } finally {
            stages.merge(stage, (System.nanoTime() - t0) / 1_000_000, Long::sum);
        }
    }

    long totalMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    Map<String, Long> snapshot() {
        Map<String, Long> copy = new LinkedHashMap<>(stages);
        copy.put("total", totalMillis());
        return copy;
    }
}

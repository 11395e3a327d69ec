package com.eainde.legalqa.thread;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fixed pool for the blocking retriever and generator calls. Each task runs with the MDC of the
 * thread that submitted it, so {@code sessionId} and {@code requestId} reach the worker's logs.
 * <p>
 * Futures returned by {@code submit} interrupt their worker on {@code cancel(true)}, which frees
 * the thread when a caller gives up on a slow upstream call.
 */
@Slf4j
public class MdcAwareExecutor extends AbstractExecutorService implements AutoCloseable {

    private final ExecutorService delegate;

    public MdcAwareExecutor(int threads) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("legalqa-worker-");
        threadFactory.setDaemon(true);
        this.delegate = Executors.newFixedThreadPool(threads, threadFactory);
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the submitting thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear(); // pool threads are reused
            }
        });
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }

    @Override
    public List<Runnable> shutdownNow() {
        return delegate.shutdownNow();
    }

    @Override
    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    @Override
    public boolean isTerminated() {
        return delegate.isTerminated();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return delegate.awaitTermination(timeout, unit);
    }

    @Override
    public void close() {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not drain in 5s, interrupting remaining tasks");
                delegate.shutdownNow();
            }
        } catch (InterruptedException e) {
            delegate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

package com.eainde.legalqa.retrieval;

import com.eainde.legalqa.exception.RetrievalException;
import com.eainde.legalqa.model.RawPassage;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs every call of the wrapped {@link LegalRetriever} on {@code executor} and gives up after
 * {@code timeout}. A call that overruns is interrupted and reported as a {@link RetrievalException}.
 * <p>
 * Callers must not themselves run on {@code executor}: a saturated pool would then wait on itself.
 */
@Slf4j
public class TimeBoundedLegalRetriever implements LegalRetriever {

    private final LegalRetriever delegate;
    private final Executor executor;
    private final Duration timeout;

    public TimeBoundedLegalRetriever(LegalRetriever delegate, Executor executor, Duration timeout) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public List<RawPassage> search(String query, int topK, Map<String, Object> filters) {
        return bounded("search", () -> delegate.search(query, topK, filters));
    }

    @Override
    public List<RawPassage> getByCaseId(String caseId) {
        return bounded("case lookup " + caseId, () -> delegate.getByCaseId(caseId));
    }

    @Override
    public List<RawPassage> findExactCase(String reference) {
        return bounded("exact lookup '" + reference + "'", () -> delegate.findExactCase(reference));
    }

    private List<RawPassage> bounded(String operation, Supplier<List<RawPassage>> call) {
        FutureTask<List<RawPassage>> task = new FutureTask<>(call::get);
        executor.execute(task);
        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Retriever {} timed out after {}", operation, timeout);
            throw new RetrievalException("Retriever " + operation + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new RetrievalException("Interrupted during retriever " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RetrievalException re) {
                throw re;
            }
            throw new RetrievalException("Retriever " + operation + " failed: " + cause.getMessage(), cause);
        }
    }
}

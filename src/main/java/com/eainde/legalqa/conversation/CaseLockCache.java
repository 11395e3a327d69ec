package com.eainde.legalqa.conversation;

import com.eainde.legalqa.model.ActiveCaseContext;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Optional;

/**
 * Advisory session id to last-locked case mapping, bounded and expiring.
 *
 * <p>Only read when the durable store cannot be reached. Concurrent writers for the same
 * session are last-writer-wins.</p>
 */
public class CaseLockCache {

    private final Cache<String, ActiveCaseContext> cache;

    public CaseLockCache(long maximumSize, Duration ttl) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
    }

    public void remember(String sessionId, ActiveCaseContext activeCase) {
        if (activeCase == null) {
            cache.invalidate(sessionId);
        } else {
            cache.put(sessionId, activeCase);
        }
    }

    public Optional<ActiveCaseContext> lastKnown(String sessionId) {
        return Optional.ofNullable(cache.getIfPresent(sessionId));
    }

    public void forget(String sessionId) {
        cache.invalidate(sessionId);
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }
}

package com.eainde.legalqa.conversation;

import com.eainde.legalqa.exception.ConversationStoreException;
import com.eainde.legalqa.model.ActiveCaseContext;
import com.eainde.legalqa.model.ConversationTurn;
import com.eainde.legalqa.model.Session;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads and writes conversation state on behalf of the pipeline.
 *
 * <h3>Store outages:</h3>
 * <p>{@link #load(String, String)} degrades to a fresh session carrying the case from the
 * {@link CaseLockCache} when the store throws. Writes propagate
 * {@link ConversationStoreException}; the caller decides whether a failed write matters.</p>
 */
@Slf4j
public class ConversationAccessor {

    private final ConversationStore store;
    private final CaseLockCache lockCache;
    private final ConversationSummarizer summarizer;
    private final int historyWindow;
    private final Clock clock;

    public ConversationAccessor(ConversationStore store, CaseLockCache lockCache,
                                ConversationSummarizer summarizer, int historyWindow, Clock clock) {
        this.store = store;
        this.lockCache = lockCache;
        this.summarizer = summarizer;
        this.historyWindow = historyWindow;
        this.clock = clock;
    }

    // =========================================================================
    //  Read path
    // =========================================================================

    /**
     * Loads the session (creating it when missing), its recent turns and the rolling summary.
     *
     * @param sessionId session to load; a new id is generated when {@code null} or blank
     * @param ownerId   owner recorded on newly created sessions
     */
    public ConversationState load(String sessionId, String ownerId) {
        String id = (sessionId == null || sessionId.isBlank()) ? UUID.randomUUID().toString() : sessionId;
        try {
            Session session = getOrCreateSession(id, ownerId);
            List<ConversationTurn> turns = store.recentTurns(id, historyWindow);
            String summary = summarizer.summarize(turns, session.activeCase());
            return new ConversationState(session, turns, summary, false);
        } catch (ConversationStoreException e) {
            Optional<ActiveCaseContext> cached = lockCache.lastKnown(id);
            log.warn("Conversation store unavailable for session {}, continuing with cached case {}: {}",
                    id, cached.map(ActiveCaseContext::displayReference).orElse("none"), e.getMessage());
            Session session = Session.open(id, ownerId, null, Instant.now(clock))
                    .withActiveCase(cached.orElse(null));
            return new ConversationState(session, List.of(),
                    summarizer.summarize(List.of(), session.activeCase()), true);
        }
    }

    public Session getOrCreateSession(String sessionId, String ownerId) {
        Optional<Session> existing = store.findSession(sessionId);
        if (existing.isPresent()) {
            return existing.get();
        }
        Session created = Session.open(sessionId, ownerId, null, Instant.now(clock));
        log.info("Created session {} for owner {}", sessionId, ownerId);
        return store.saveSession(created);
    }

    public List<Session> listSessions(String ownerId, boolean activeOnly) {
        return store.listSessions(ownerId, activeOnly);
    }

    public SessionStatistics statistics(String sessionId) {
        Session session = store.findSession(sessionId)
                .orElseThrow(() -> new ConversationStoreException("Unknown session " + sessionId));
        int turnCount = store.countTurns(sessionId);
        List<ConversationTurn> turns = store.recentTurns(sessionId, turnCount);
        double avgConfidence = turns.stream().mapToDouble(ConversationTurn::confidence).average().orElse(0.0);
        String activeCase = session.activeCase() == null ? null : session.activeCase().displayReference();
        return new SessionStatistics(sessionId, turnCount, avgConfidence, session.lastActivity(),
                activeCase, session.active());
    }

    // =========================================================================
    //  Write path
    // =========================================================================

    /**
     * Appends a turn, then updates the session's last activity, query count and active case. The
     * session counters move only once the turn is stored.
     *
     * @param session    session as loaded at the start of the request
     * @param turn       the completed exchange; the store assigns its sequence number
     * @param activeCase the case lock after this turn, or {@code null} to clear it
     * @return the stored turn
     */
    public ConversationTurn recordExchange(Session session, ConversationTurn turn, ActiveCaseContext activeCase) {
        lockCache.remember(session.id(), activeCase);

        Instant now = Instant.now(clock);
        Optional<Session> existing = store.findSession(session.id());
        if (existing.isEmpty()) {
            // loaded while the store was down
            store.saveSession(session);
        }
        Session current = existing.orElse(session);
        ConversationTurn stored = store.appendTurn(new ConversationTurn(session.id(), 0, turn.query(),
                turn.standaloneQuery(), turn.answer(), turn.status(), turn.confidence(),
                activeCase == null ? null : activeCase.caseId(), turn.sources(), now));

        store.saveSession(current.withTurnRecorded(turn.query(), now));
        if (activeCase == null) {
            store.clearActiveCase(session.id());
        } else {
            store.saveActiveCase(session.id(), activeCase);
        }
        log.debug("Recorded turn {} for session {} (case={})", stored.sequence(), session.id(),
                activeCase == null ? "none" : activeCase.caseId());
        return stored;
    }

    public boolean archiveSession(String sessionId) {
        boolean archived = store.archiveSession(sessionId);
        if (archived) {
            lockCache.forget(sessionId);
            log.info("Archived session {}", sessionId);
        }
        return archived;
    }
}

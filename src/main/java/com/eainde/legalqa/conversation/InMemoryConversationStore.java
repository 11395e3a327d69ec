package com.eainde.legalqa.conversation;

import com.eainde.legalqa.exception.ConversationStoreException;
import com.eainde.legalqa.model.ActiveCaseContext;
import com.eainde.legalqa.model.ConversationTurn;
import com.eainde.legalqa.model.Session;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local store, the default when no database is configured.
 */
public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, List<ConversationTurn>> turns = new ConcurrentHashMap<>();

    @Override
    public Optional<Session> findSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Session saveSession(Session session) {
        sessions.put(session.id(), session);
        return session;
    }

    @Override
    public List<Session> listSessions(String ownerId, boolean activeOnly) {
        return sessions.values().stream()
                .filter(s -> ownerId == null || ownerId.equals(s.ownerId()))
                .filter(s -> !activeOnly || s.active())
                .sorted(Comparator.comparing(Session::lastActivity, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    @Override
    public boolean archiveSession(String sessionId) {
        return sessions.computeIfPresent(sessionId, (id, s) -> s.archived()) != null;
    }

    @Override
    public ConversationTurn appendTurn(ConversationTurn turn) {
        if (!sessions.containsKey(turn.sessionId())) {
            throw new ConversationStoreException("Unknown session " + turn.sessionId());
        }
        List<ConversationTurn> log = turns.computeIfAbsent(turn.sessionId(), id -> new CopyOnWriteArrayList<>());
        synchronized (log) {
            ConversationTurn stored = turn.withSequence(log.size() + 1);
            log.add(stored);
            return stored;
        }
    }

    @Override
    public List<ConversationTurn> recentTurns(String sessionId, int limit) {
        List<ConversationTurn> all = turns.getOrDefault(sessionId, List.of());
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return new ArrayList<>(all.subList(from, all.size()));
    }

    @Override
    public int countTurns(String sessionId) {
        return turns.getOrDefault(sessionId, List.of()).size();
    }

    @Override
    public void saveActiveCase(String sessionId, ActiveCaseContext activeCase) {
        requireSession(sessionId);
        sessions.computeIfPresent(sessionId, (id, s) -> s.withActiveCase(activeCase));
    }

    @Override
    public void clearActiveCase(String sessionId) {
        requireSession(sessionId);
        sessions.computeIfPresent(sessionId, (id, s) -> s.withActiveCase(null));
    }

    private void requireSession(String sessionId) {
        if (!sessions.containsKey(sessionId)) {
            throw new ConversationStoreException("Unknown session " + sessionId);
        }
    }
}

package com.eainde.legalqa.conversation;

import com.eainde.legalqa.model.ActiveCaseContext;
import com.eainde.legalqa.model.ConversationTurn;
import com.eainde.legalqa.model.Session;

import java.util.List;
import java.util.Optional;

/**
 * Durable conversation state: sessions, the append-only turn log and the single-slot
 * active case per session.
 *
 * <p>Implementations throw {@link com.eainde.legalqa.exception.ConversationStoreException}
 * on storage failures.</p>
 */
public interface ConversationStore {

    Optional<Session> findSession(String sessionId);

    /**
     * Inserts or replaces the session row.
     */
    Session saveSession(Session session);

    List<Session> listSessions(String ownerId, boolean activeOnly);

    /**
     * Marks the session inactive. Turns are kept.
     *
     * @return {@code false} when no such session exists
     */
    boolean archiveSession(String sessionId);

    /**
     * Appends the turn under the next free sequence number of its session. The sequence carried
     * by {@code turn} is ignored.
     *
     * @return the turn as stored, with its assigned sequence
     */
    ConversationTurn appendTurn(ConversationTurn turn);

    /**
     * The last {@code limit} turns of a session, oldest first.
     */
    List<ConversationTurn> recentTurns(String sessionId, int limit);

    int countTurns(String sessionId);

    /**
     * Replaces the session's active case.
     */
    void saveActiveCase(String sessionId, ActiveCaseContext activeCase);

    void clearActiveCase(String sessionId);
}

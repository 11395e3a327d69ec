package com.eainde.legalqa.conversation;

import com.eainde.legalqa.model.ActiveCaseContext;
import com.eainde.legalqa.model.ConversationTurn;
import com.eainde.legalqa.model.Session;

import java.util.List;

/**
 * Conversation state loaded at the start of a request.
 *
 * @param session     the session, created if it did not exist
 * @param recentTurns last turns, oldest first
 * @param summary     rolling summary over {@code recentTurns}
 * @param degraded    {@code true} when the store was unreachable and the state came from the advisory cache
 */
public record ConversationState(
        Session session,
        List<ConversationTurn> recentTurns,
        String summary,
        boolean degraded
) {

    public ConversationState {
        recentTurns = recentTurns == null ? List.of() : List.copyOf(recentTurns);
    }

    public ActiveCaseContext activeCase() {
        return session.activeCase();
    }

    public String previousQuery() {
        return recentTurns.isEmpty() ? null : recentTurns.get(recentTurns.size() - 1).query();
    }

    public ConversationTurn lastTurn() {
        return recentTurns.isEmpty() ? null : recentTurns.get(recentTurns.size() - 1);
    }
}

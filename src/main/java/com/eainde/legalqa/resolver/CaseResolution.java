package com.eainde.legalqa.resolver;

import com.eainde.legalqa.model.ActiveCaseContext;

import java.util.List;

/**
 * Outcome of case resolution for one question.
 *
 * @param state           {@code LOCKED} or {@code UNLOCKED} after this question
 * @param activeCase      the lock, or {@code null} when unlocked
 * @param standaloneQuery rewritten query for retrieval
 * @param reason          which rule decided the state
 * @param lockChanged     whether the lock differs from the one the session had
 * @param followUpSignals follow-up indicators found in the question
 */
public record CaseResolution(
        State state,
        ActiveCaseContext activeCase,
        String standaloneQuery,
        Reason reason,
        boolean lockChanged,
        List<String> followUpSignals
) {

    public enum State { LOCKED, UNLOCKED }

    public enum Reason {
        PROCEDURAL,
        GENERAL_OPINION,
        EXPLICIT_RESOLVED,
        EXPLICIT_UNRESOLVED,
        TOPIC_NEW,
        TOPIC_SAME,
        FOLLOW_UP_INHERITED,
        NO_CASE
    }

    public CaseResolution {
        followUpSignals = followUpSignals == null ? List.of() : List.copyOf(followUpSignals);
    }

    public boolean isLocked() {
        return state == State.LOCKED;
    }

    public String lockedCaseId() {
        return activeCase == null ? null : activeCase.caseId();
    }
}

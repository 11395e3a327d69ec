package com.eainde.legalqa.pipeline;

import com.eainde.legalqa.model.AccessLevel;
import lombok.Builder;

import java.util.Map;

/**
 * One question from the front end.
 *
 * <h3>Usage:</h3>
 * <pre>
 * AnswerRequest request = AnswerRequest.builder()
 *         .question("What was decided in W.P. 1234/2021 Lahore?")
 *         .sessionId(sessionId)
 *         .userId("u-42")
 *         .accessLevel(AccessLevel.LAWYER)
 *         .build();
 * </pre>
 *
 * @param question    the question as typed
 * @param sessionId   conversation to continue; a new session is opened when {@code null}
 * @param userId      owner of the session
 * @param accessLevel caller's access level; the configured default when {@code null}
 * @param filters     metadata equality filters passed to retrieval
 */
@Builder
public record AnswerRequest(
        String question,
        String sessionId,
        String userId,
        AccessLevel accessLevel,
        Map<String, Object> filters
) {

    public AnswerRequest {
        filters = filters == null ? Map.of() : Map.copyOf(filters);
    }

    public static AnswerRequest of(String question, String sessionId, String userId) {
        return new AnswerRequest(question, sessionId, userId, null, null);
    }
}

package com.eainde.legalqa.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A conversation between one owner and the assistant.
 *
 * <p>Sessions are archived by clearing {@code active}; they are never hard-deleted.</p>
 *
 * @param id           session identifier
 * @param ownerId      owning user
 * @param title        display title, derived from the first question
 * @param createdAt    creation time
 * @param lastActivity time of the last recorded turn
 * @param active       {@code false} once archived
 * @param activeCase   the current case lock, or {@code null}
 * @param lastQuery    the most recent question
 * @param contextData  free-form string context
 * @param totalQueries number of turns recorded
 */
public record Session(
        @JsonProperty("id")           String id,
        @JsonProperty("ownerId")      String ownerId,
        @JsonProperty("title")        String title,
        @JsonProperty("createdAt")    Instant createdAt,
        @JsonProperty("lastActivity") Instant lastActivity,
        @JsonProperty("active")       boolean active,
        @JsonProperty("activeCase")   ActiveCaseContext activeCase,
        @JsonProperty("lastQuery")    String lastQuery,
        @JsonProperty("contextData")  Map<String, String> contextData,
        @JsonProperty("totalQueries") int totalQueries
) {

    public Session {
        contextData = contextData == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(contextData));
    }

    public static Session open(String id, String ownerId, String title, Instant now) {
        return new Session(id, ownerId, title, now, now, true, null, null, Map.of(), 0);
    }

    public boolean hasActiveCase() {
        return activeCase != null;
    }

    public Session withActiveCase(ActiveCaseContext newActiveCase) {
        return new Session(id, ownerId, title, createdAt, lastActivity, active, newActiveCase,
                lastQuery, contextData, totalQueries);
    }

    public Session withTurnRecorded(String query, Instant at) {
        String newTitle = (title == null || title.isBlank()) ? titleFrom(query) : title;
        return new Session(id, ownerId, newTitle, createdAt, at, active, activeCase, query,
                contextData, totalQueries + 1);
    }

    public Session archived() {
        return new Session(id, ownerId, title, createdAt, lastActivity, false, activeCase,
                lastQuery, contextData, totalQueries);
    }

    private static String titleFrom(String query) {
        if (query == null) {
            return "New conversation";
        }
        String trimmed = query.trim();
        return trimmed.length() > 50 ? trimmed.substring(0, 50) + "..." : trimmed;
    }
}

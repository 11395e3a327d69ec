package com.eainde.legalqa.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Aggregate view over one session's turns.
 */
public record SessionStatistics(
        @JsonProperty("sessionId")         String sessionId,
        @JsonProperty("turnCount")         int turnCount,
        @JsonProperty("averageConfidence") double averageConfidence,
        @JsonProperty("lastActivity")      Instant lastActivity,
        @JsonProperty("activeCase")        String activeCase,
        @JsonProperty("active")            boolean active
) {}

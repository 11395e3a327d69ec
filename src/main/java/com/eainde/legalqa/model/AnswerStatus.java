package com.eainde.legalqa.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Terminal status of one answered question.
 */
public enum AnswerStatus {
    SUCCESS,
    BLOCKED,
    NO_RESULTS,
    CONTEXT_ERROR,
    GENERATION_ERROR,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

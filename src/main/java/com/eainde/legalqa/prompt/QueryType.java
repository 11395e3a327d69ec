package com.eainde.legalqa.prompt;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse kind of a legal question, used for template selection.
 */
public enum QueryType {
    CASE_INQUIRY,
    LAW_RESEARCH,
    PROCEDURAL_GUIDANCE,
    JUDGE_INQUIRY,
    LAWYER_INQUIRY,
    CITATION_LOOKUP,
    CONSTITUTIONAL_QUESTION,
    CRIMINAL_LAW,
    CIVIL_LAW,
    FAMILY_LAW,
    PROPERTY_LAW,
    GENERAL_LEGAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

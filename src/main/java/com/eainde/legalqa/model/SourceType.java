package com.eainde.legalqa.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of legal material a retrieved passage represents.
 *
 * <p>Declaration order is the order in which groups are emitted into the packed context.</p>
 */
public enum SourceType {

    STATUTE("statute", 10, "RELEVANT STATUTES AND LAWS"),
    CONSTITUTIONAL_ARTICLE("constitutional_article", 9, "CONSTITUTIONAL PROVISIONS"),
    CASE_LAW("case_law", 8, "RELEVANT CASE LAW"),
    JUDGMENT("judgment", 7, "COURT JUDGMENTS"),
    ORDER("order", 6, "COURT ORDERS"),
    LEGAL_PRINCIPLE("legal_principle", 5, "LEGAL PRINCIPLES"),
    PROCEDURAL_GUIDANCE("procedural_guidance", 4, "PROCEDURAL GUIDANCE"),
    CASE_METADATA("case_metadata", 3, "CASE INFORMATION"),
    DOCUMENT_TEXT("document_text", 2, "DOCUMENT EXCERPTS"),
    GENERAL("general", 1, "GENERAL LEGAL INFORMATION");

    private final String key;
    private final int basePriority;
    private final String sectionHeader;

    SourceType(String key, int basePriority, String sectionHeader) {
        this.key = key;
        this.basePriority = basePriority;
        this.sectionHeader = sectionHeader;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public int basePriority() {
        return basePriority;
    }

    public String sectionHeader() {
        return sectionHeader;
    }

    @JsonCreator
    public static SourceType fromKey(String key) {
        if (key == null) {
            return GENERAL;
        }
        for (SourceType type : values()) {
            if (type.key.equalsIgnoreCase(key.trim())) {
                return type;
            }
        }
        return GENERAL;
    }
}

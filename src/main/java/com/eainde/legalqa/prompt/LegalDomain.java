package com.eainde.legalqa.prompt;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Area of law a question belongs to.
 */
public enum LegalDomain {
    CONSTITUTIONAL,
    CRIMINAL,
    CIVIL,
    FAMILY,
    PROPERTY,
    COMMERCIAL,
    ADMINISTRATIVE,
    PROCEDURAL,
    GENERAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Domain for a passage's {@code legal_domain} metadata value, {@code null} when unknown.
     */
    public static LegalDomain fromMetadata(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (LegalDomain domain : values()) {
            if (domain.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return domain;
            }
        }
        return null;
    }
}

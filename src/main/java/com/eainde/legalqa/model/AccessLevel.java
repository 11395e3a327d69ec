package com.eainde.legalqa.model;

/**
 * Caller access tier. Ordered from least to most privileged.
 */
public enum AccessLevel {
    PUBLIC,
    LAWYER,
    JUDGE,
    ADMIN;

    public boolean atLeast(AccessLevel required) {
        return this.ordinal() >= required.ordinal();
    }
}

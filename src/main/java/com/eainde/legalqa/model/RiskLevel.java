package com.eainde.legalqa.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Returns the higher of the two levels.
     */
    public RiskLevel max(RiskLevel other) {
        return other != null && other.ordinal() > this.ordinal() ? other : this;
    }
}

package com.complypilot.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall risk band derived from the compliance percentage.
 * Each band includes its lower bound.
 */
public enum RiskLevel {
    LOW, MEDIUM, HIGH, CRITICAL;

    public static RiskLevel fromScore(int overallPercentage) {
        if (overallPercentage >= 80) return LOW;
        if (overallPercentage >= 60) return MEDIUM;
        if (overallPercentage >= 40) return HIGH;
        return CRITICAL;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}

package com.complypilot.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Remediation priority of a gap or action. Declaration order is the sort rank (HIGH first).
 */
public enum Priority {
    HIGH, MEDIUM, LOW;

    /** Maps a question weight to the priority of the gap it produces when answered "no". */
    public static Priority forWeight(int weight) {
        if (weight >= 3) return HIGH;
        if (weight >= 2) return MEDIUM;
        return LOW;
    }

    public int rank() {
        return ordinal();
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}

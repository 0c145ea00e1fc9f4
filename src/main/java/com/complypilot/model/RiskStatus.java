package com.complypilot.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a risk in a register. Any status may follow any other.
 */
public enum RiskStatus {
    IDENTIFIED, MITIGATING, RESOLVED, ACCEPTED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}

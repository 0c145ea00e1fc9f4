package com.complypilot.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Compliance framework a catalog question belongs to.
 */
public enum ComplianceCategory {
    GDPR("GDPR"),
    CYBER_ESSENTIALS("Cyber Essentials");

    private final String label;

    ComplianceCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

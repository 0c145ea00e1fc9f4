package com.complypilot.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Likelihood or impact rating of a template risk. */
public enum RiskRating {
    LOW, MEDIUM, HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}

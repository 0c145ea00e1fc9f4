package com.complypilot.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnalysisStatus {
    PENDING, COMPLETED, FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}

package com.complypilot.model;

/**
 * Reference risk for a business type. Copied into a register, never referenced by it.
 */
public record RiskTemplateEntry(
        String riskId,
        String title,
        String description,
        RiskRating likelihood,
        RiskRating impact,
        String category,
        String mitigation
) {}

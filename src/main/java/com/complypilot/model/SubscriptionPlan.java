package com.complypilot.model;

/**
 * A purchasable plan. A limit of -1 means unlimited.
 */
public record SubscriptionPlan(
        String id,
        String name,
        int price,
        String currency,
        String interval,
        PlanFeatures features,
        String description
) {
    public record PlanFeatures(
            int healthChecksPerMonth,
            int documentAnalysesPerMonth,
            boolean riskRegister,
            boolean prioritySupport,
            boolean exportReports,
            boolean dedicatedSupport,
            boolean customIntegrations
    ) {}
}

package com.complypilot.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Stored subscription of a user. Users without one are on the free plan.
 */
@Document(collection = "subscriptions")
public record Subscription(
        @Id String userId,
        String planType,
        String status,
        SubscriptionPlan.PlanFeatures features
) {}

package com.complypilot.catalog;

import com.complypilot.model.SubscriptionPlan;
import com.complypilot.model.SubscriptionPlan.PlanFeatures;

import java.util.List;
import java.util.Optional;

/**
 * Fixed list of subscription plans, priced monthly in GBP. Payment is handled elsewhere.
 */
public final class SubscriptionPlans {

    public static final String FREE = "free";

    private static final int UNLIMITED = -1;

    private static final List<SubscriptionPlan> PLANS = List.of(
            new SubscriptionPlan(FREE, "Free", 0, "GBP", "month",
                    new PlanFeatures(1, 3, true, false, false, false, false),
                    "Perfect for getting started with compliance"),
            new SubscriptionPlan("starter", "Starter", 29, "GBP", "month",
                    new PlanFeatures(5, 15, true, false, true, false, false),
                    "For small businesses starting their compliance journey"),
            new SubscriptionPlan("professional", "Professional", 79, "GBP", "month",
                    new PlanFeatures(UNLIMITED, 50, true, true, true, false, false),
                    "For growing businesses with serious compliance needs"),
            new SubscriptionPlan("enterprise", "Enterprise", 199, "GBP", "month",
                    new PlanFeatures(UNLIMITED, UNLIMITED, true, true, true, true, true),
                    "For organisations requiring full compliance support")
    );

    private SubscriptionPlans() {
    }

    public static List<SubscriptionPlan> all() {
        return PLANS;
    }

    public static Optional<SubscriptionPlan> find(String planId) {
        return PLANS.stream().filter(p -> p.id().equals(planId)).findFirst();
    }

    public static SubscriptionPlan free() {
        return PLANS.get(0);
    }
}

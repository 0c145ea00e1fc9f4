package com.complypilot.service;

import com.complypilot.catalog.SubscriptionPlans;
import com.complypilot.model.Subscription;
import com.complypilot.model.SubscriptionPlan;
import com.complypilot.repository.SubscriptionRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only view of plans and of the user's subscription.
 */
@Service
public class SubscriptionService {

    private final SubscriptionRepository repository;

    public SubscriptionService(SubscriptionRepository repository) {
        this.repository = repository;
    }

    public List<SubscriptionPlan> plans() {
        return SubscriptionPlans.all();
    }

    /** The stored subscription, or an active free plan when the user has none. */
    public Subscription current(String subjectId) {
        return repository.findById(subjectId).orElseGet(() -> {
            SubscriptionPlan free = SubscriptionPlans.free();
            return new Subscription(subjectId, free.id(), "active", free.features());
        });
    }
}

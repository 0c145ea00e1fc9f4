package com.complypilot.controller;

import com.complypilot.model.Subscription;
import com.complypilot.model.SubscriptionPlan;
import com.complypilot.model.User;
import com.complypilot.service.SubscriptionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/subscription")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    public SubscriptionController(SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    @GetMapping
    public Subscription current(@CurrentUser User user) {
        return subscriptionService.current(user.userId());
    }

    /** Public: no session required. */
    @GetMapping("/plans")
    public Map<String, List<SubscriptionPlan>> plans() {
        return Map.of("plans", subscriptionService.plans());
    }
}

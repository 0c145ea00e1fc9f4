package com.complypilot.controller;

import com.complypilot.model.Dashboard;
import com.complypilot.model.User;
import com.complypilot.service.DashboardService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping
    public Dashboard dashboard(@CurrentUser User user) {
        return dashboardService.dashboard(user);
    }
}

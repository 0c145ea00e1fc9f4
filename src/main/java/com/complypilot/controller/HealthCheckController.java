package com.complypilot.controller;

import com.complypilot.model.Answer;
import com.complypilot.model.Assessment;
import com.complypilot.model.User;
import com.complypilot.service.AssessmentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Compliance health check: questionnaire, submission and history.
 */
@RestController
@RequestMapping("/api/health-check")
public class HealthCheckController {

    private final AssessmentService assessmentService;

    public HealthCheckController(AssessmentService assessmentService) {
        this.assessmentService = assessmentService;
    }

    @GetMapping("/questions")
    public AssessmentService.CatalogView questions(@CurrentUser User user) {
        return assessmentService.catalog();
    }

    @PostMapping("/submit")
    public Assessment submit(@CurrentUser User user, @RequestBody SubmitRequest request) {
        return assessmentService.submit(user.userId(), request.responses());
    }

    @GetMapping("/history")
    public Map<String, List<Assessment>> history(@CurrentUser User user) {
        return Map.of("health_checks", assessmentService.history(user.userId()));
    }

    /** Latest assessment, or an empty 200 response when none was submitted. */
    @GetMapping("/latest")
    public ResponseEntity<Assessment> latest(@CurrentUser User user) {
        return ResponseEntity.ok(assessmentService.latest(user.userId()).orElse(null));
    }

    public record SubmitRequest(List<Answer> responses) {}
}

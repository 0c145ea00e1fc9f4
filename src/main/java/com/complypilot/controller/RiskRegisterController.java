package com.complypilot.controller;

import com.complypilot.model.Risk;
import com.complypilot.model.RiskRegister;
import com.complypilot.model.RiskStatus;
import com.complypilot.model.User;
import com.complypilot.exception.InvalidInputException;
import com.complypilot.service.RiskRegisterService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/risk-register")
public class RiskRegisterController {

    private final RiskRegisterService riskRegisterService;

    public RiskRegisterController(RiskRegisterService riskRegisterService) {
        this.riskRegisterService = riskRegisterService;
    }

    /** Generates a register from the business-type template, replacing any existing one. */
    @PostMapping("/generate")
    public RiskRegister generate(@CurrentUser User user, @RequestBody GenerateRequest request) {
        if (request.businessType() == null || request.businessType().isBlank()) {
            throw new InvalidInputException("business_type is required");
        }
        return riskRegisterService.generate(user.userId(), request.businessType(), request.industry());
    }

    /** The register, or an empty 200 response when none was generated. */
    @GetMapping
    public ResponseEntity<RiskRegister> get(@CurrentUser User user) {
        return ResponseEntity.ok(riskRegisterService.get(user.userId()).orElse(null));
    }

    @PutMapping("/{riskId}")
    public Map<String, Object> update(@CurrentUser User user, @PathVariable String riskId,
                                      @RequestBody UpdateRequest request) {
        if (request.status() == null) {
            throw new InvalidInputException("status is required");
        }
        Risk risk = riskRegisterService.updateStatus(user.userId(), riskId, request.status(), request.notes());
        return Map.of("message", "Risk updated successfully", "risk_id", risk.riskId(), "status", risk.status());
    }

    public record GenerateRequest(String businessType, String industry) {}

    public record UpdateRequest(RiskStatus status, String notes) {}
}

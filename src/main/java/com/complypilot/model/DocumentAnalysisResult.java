package com.complypilot.model;

import java.time.Instant;

/**
 * Response of a successful document analysis.
 */
public record DocumentAnalysisResult(
        String documentId,
        String filename,
        ComplianceAnalysis analysis,
        Instant analyzedAt
) {}

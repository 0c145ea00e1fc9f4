package com.complypilot.agent;

import com.complypilot.model.ComplianceAnalysis;

/**
 * External analyzer that turns a policy document excerpt into a structured
 * GDPR / Cyber Essentials gap analysis.
 */
public interface ComplianceAnalyzer {

    /**
     * @param documentExcerpt document text, already truncated by the caller
     * @return a schema-valid analysis
     * @throws com.complypilot.exception.AnalyzerException on transport, parse or schema errors
     */
    ComplianceAnalysis analyze(String documentExcerpt);
}

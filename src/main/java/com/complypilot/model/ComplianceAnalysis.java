package com.complypilot.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;

/**
 * Structured gap analysis of a policy document, as returned by the analyzer.
 *
 * @param documentType              What kind of policy the document appears to be
 * @param overallAssessment         Short overall verdict
 * @param gdprCompliance            GDPR sub-assessment
 * @param cyberEssentialsCompliance Cyber Essentials sub-assessment
 * @param priorityActions           Actions to take, most important first
 * @param riskSummary               Paragraph on the compliance risk exposure
 */
public record ComplianceAnalysis(
        @JsonProperty(value = "document_type", required = true)
        @JsonPropertyDescription("What type of policy this document appears to be")
        String documentType,

        @JsonProperty(value = "overall_assessment", required = true)
        @JsonPropertyDescription("Brief overall assessment")
        String overallAssessment,

        @JsonProperty(value = "gdpr_compliance", required = true)
        FrameworkCompliance gdprCompliance,

        @JsonProperty(value = "cyber_essentials_compliance", required = true)
        FrameworkCompliance cyberEssentialsCompliance,

        @JsonProperty("priority_actions")
        List<PriorityAction> priorityActions,

        @JsonProperty(value = "risk_summary", required = true)
        @JsonPropertyDescription("Brief paragraph summarizing the compliance risk exposure")
        String riskSummary
) {
    public ComplianceAnalysis {
        priorityActions = priorityActions != null ? List.copyOf(priorityActions) : List.of();
    }

    /**
     * Compliance of the document against one framework.
     *
     * @param score           0-100
     * @param status          compliant, partial, non-compliant or not-applicable
     */
    public record FrameworkCompliance(
            @JsonProperty(value = "score", required = true)
            @JsonPropertyDescription("Score from 0 to 100")
            int score,

            @JsonProperty(value = "status", required = true)
            @JsonPropertyDescription("compliant | partial | non-compliant | not-applicable")
            String status,

            @JsonProperty("strengths") List<String> strengths,
            @JsonProperty("gaps") List<String> gaps,
            @JsonProperty("recommendations") List<String> recommendations
    ) {
        public FrameworkCompliance {
            strengths = strengths != null ? List.copyOf(strengths) : List.of();
            gaps = gaps != null ? List.copyOf(gaps) : List.of();
            recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
        }
    }

    /**
     * A concrete remediation step.
     *
     * @param framework GDPR, Cyber Essentials or Both
     */
    public record PriorityAction(
            @JsonProperty(value = "priority", required = true) Priority priority,
            @JsonProperty(value = "action", required = true) String action,
            @JsonProperty("framework") String framework,
            @JsonProperty("rationale") String rationale
    ) {}
}

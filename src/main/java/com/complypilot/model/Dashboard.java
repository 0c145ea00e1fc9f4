package com.complypilot.model;

import java.time.Instant;
import java.util.List;

/**
 * Read-only summary of a subject's latest assessment, register and documents.
 * Score fields are {@code null} until the first assessment is submitted.
 */
public record Dashboard(
        User user,
        Integer complianceScore,
        Integer gdprScore,
        Integer cyberEssentialsScore,
        RiskLevel riskLevel,
        Instant lastHealthCheck,
        RiskStats riskStats,
        int totalDocuments,
        int analyzedDocuments,
        List<PriorityActionItem> priorityActions,
        List<PolicyDocument> recentDocuments
) {

    public record RiskStats(int identified, int mitigating, int resolved, int accepted, int total) {}

    /**
     * An entry of the priority-action feed.
     *
     * @param type       compliance_gap or pending_analysis
     * @param documentId Set only for pending_analysis entries
     */
    public record PriorityActionItem(
            String type,
            String category,
            String subcategory,
            String description,
            String guidance,
            String documentId,
            Priority priority
    ) {
        public static PriorityActionItem forGap(Gap gap) {
            return new PriorityActionItem("compliance_gap", gap.category().label(), gap.subcategory(),
                    gap.question(), gap.guidance(), null, gap.priority());
        }

        public static PriorityActionItem forPendingDocument(PolicyDocument document) {
            return new PriorityActionItem("pending_analysis", "Documents", null,
                    "Analyze document: " + document.filename(), null, document.id(), Priority.MEDIUM);
        }
    }
}

package com.complypilot.model;

/**
 * A question answered "no", with its remediation guidance and priority.
 */
public record Gap(
        String questionId,
        ComplianceCategory category,
        String subcategory,
        String question,
        String guidance,
        Priority priority
) {
    public static Gap of(Question question) {
        return new Gap(question.id(), question.category(), question.subcategory(),
                question.question(), question.guidance(), Priority.forWeight(question.weight()));
    }
}

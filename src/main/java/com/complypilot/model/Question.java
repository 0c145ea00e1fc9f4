package com.complypilot.model;

/**
 * A weighted compliance question from the catalog.
 *
 * @param id          Stable identifier (e.g. gdpr_1, ce_7)
 * @param category    Framework the question belongs to
 * @param subcategory Topic within the framework (e.g. "Breach Response")
 * @param question    Question text shown to the user
 * @param weight      Importance, 1 to 3
 * @param guidance    Remediation guidance surfaced when the answer is "no"
 */
public record Question(
        String id,
        ComplianceCategory category,
        String subcategory,
        String question,
        int weight,
        String guidance
) {
    public Question {
        if (weight < 1 || weight > 3) {
            throw new IllegalArgumentException("Question weight must be between 1 and 3: " + id);
        }
    }
}

package com.complypilot.model;

import java.time.LocalDate;
import java.util.UUID;

/**
 * A risk tracked in a subject's register.
 *
 * @param riskId Identifier issued when the register was generated; unrelated to the template id
 */
public record Risk(
        String riskId,
        String title,
        String description,
        RiskRating likelihood,
        RiskRating impact,
        String category,
        String mitigation,
        RiskStatus status,
        String owner,
        LocalDate dueDate,
        String notes
) {
    /** Copies a template entry into a fresh, unowned risk in status IDENTIFIED. */
    public static Risk fromTemplate(RiskTemplateEntry entry) {
        return new Risk(UUID.randomUUID().toString(), entry.title(), entry.description(),
                entry.likelihood(), entry.impact(), entry.category(), entry.mitigation(),
                RiskStatus.IDENTIFIED, null, null, null);
    }

    /** Creates a copy with a new status; a blank note keeps the existing notes. */
    public Risk withStatus(RiskStatus newStatus, String newNotes) {
        String notesToKeep = newNotes != null && !newNotes.isEmpty() ? newNotes : notes;
        return new Risk(riskId, title, description, likelihood, impact, category, mitigation,
                newStatus, owner, dueDate, notesToKeep);
    }
}

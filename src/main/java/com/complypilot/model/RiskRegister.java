package com.complypilot.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * The single live risk register of a subject.
 */
@Document(collection = "risk_registers")
public record RiskRegister(
        @Id String id,
        String subjectId,
        String businessType,
        String industry,
        List<Risk> risks,
        int totalRisks,
        Instant createdAt,
        Instant updatedAt
) {
    /** Creates a copy with the given risks and update time. */
    public RiskRegister withRisks(List<Risk> newRisks, Instant now) {
        return new RiskRegister(id, subjectId, businessType, industry, List.copyOf(newRisks),
                newRisks.size(), createdAt, now);
    }
}

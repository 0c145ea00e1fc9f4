package com.complypilot.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Scored result of one health-check submission. Never modified after creation.
 *
 * @param id                  Unique identifier
 * @param subjectId           Owning user
 * @param responses           Answers exactly as submitted
 * @param complianceScore     Overall percentage (0-100)
 * @param gdprScore           GDPR percentage (0-100)
 * @param cyberEssentialsScore Cyber Essentials percentage (0-100)
 * @param riskLevel           Band derived from the overall percentage
 * @param gaps                Answered-"no" questions, highest priority first
 * @param totalGaps           Size of {@code gaps}
 * @param createdAt           Submission time
 */
@Document(collection = "health_checks")
public record Assessment(
        @Id String id,
        String subjectId,
        List<Answer> responses,
        int complianceScore,
        int gdprScore,
        int cyberEssentialsScore,
        RiskLevel riskLevel,
        List<Gap> gaps,
        int totalGaps,
        Instant createdAt
) {}

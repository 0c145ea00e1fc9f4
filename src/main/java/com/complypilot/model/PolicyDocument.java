package com.complypilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * An uploaded policy document and the state of its compliance analysis.
 * The raw content is stored but never serialized to API clients.
 */
@Document(collection = "documents")
public record PolicyDocument(
        @Id String id,
        String subjectId,
        String filename,
        String fileType,
        long fileSize,
        @JsonIgnore byte[] content,
        AnalysisStatus analysisStatus,
        ComplianceAnalysis analysisResult,
        String analysisError,
        Instant createdAt,
        Instant analyzedAt
) {
    public PolicyDocument withAnalysisResult(ComplianceAnalysis result, Instant at) {
        return new PolicyDocument(id, subjectId, filename, fileType, fileSize, content,
                AnalysisStatus.COMPLETED, result, null, createdAt, at);
    }

    /** Marks the analysis as failed, keeping any earlier result. */
    public PolicyDocument withAnalysisFailure(String error) {
        return new PolicyDocument(id, subjectId, filename, fileType, fileSize, content,
                AnalysisStatus.FAILED, analysisResult, error, createdAt, analyzedAt);
    }
}

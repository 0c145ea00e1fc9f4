package com.complypilot.service;

import com.complypilot.exception.InvalidInputException;
import com.complypilot.exception.NotFoundException;
import com.complypilot.model.AnalysisStatus;
import com.complypilot.model.PolicyDocument;
import com.complypilot.repository.PolicyDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Storage of uploaded policy documents. Analysis is handled by
 * {@link com.complypilot.orchestrator.DocumentAnalysisOrchestrator}.
 */
@Service
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

    public static final String FILE_TOO_LARGE = "File too large. Maximum size is 15 MB.";

    /** PDF, plain text, legacy Word and Word XML. */
    public static final Set<String> ALLOWED_MEDIA_TYPES = Set.of(
            "application/pdf",
            "text/plain",
            "application/msword",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document"
    );

    /** Largest content stored inline, below the 16 MB Mongo document cap. */
    public static final int MAX_CONTENT_BYTES = 15 * 1024 * 1024;

    private final PolicyDocumentRepository repository;
    private final Clock clock;

    public DocumentService(PolicyDocumentRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Stores a document awaiting analysis.
     *
     * @throws InvalidInputException if the media type is not allowed or the file exceeds
     *                               {@link #MAX_CONTENT_BYTES}
     */
    public PolicyDocument upload(String subjectId, String filename, String mediaType, byte[] content) {
        if (mediaType == null || !ALLOWED_MEDIA_TYPES.contains(mediaType)) {
            throw new InvalidInputException("Invalid file type. Please upload PDF, TXT, DOC, or DOCX files.");
        }
        byte[] bytes = content != null ? content : new byte[0];
        if (bytes.length > MAX_CONTENT_BYTES) {
            throw new InvalidInputException(FILE_TOO_LARGE);
        }
        PolicyDocument document = new PolicyDocument(UUID.randomUUID().toString(), subjectId, filename,
                mediaType, bytes.length, bytes, AnalysisStatus.PENDING, null, null, Instant.now(clock), null);
        PolicyDocument saved = repository.save(document);
        log.info("Stored document {} '{}' ({}, {} bytes) for {}", saved.id(), filename, mediaType,
                bytes.length, subjectId);
        return saved;
    }

    /** Newest first, at most 100. */
    public List<PolicyDocument> list(String subjectId) {
        return repository.findTop100BySubjectIdOrderByCreatedAtDesc(subjectId);
    }

    public PolicyDocument get(String documentId, String subjectId) {
        return repository.findByIdAndSubjectId(documentId, subjectId)
                .orElseThrow(() -> new NotFoundException("Document not found"));
    }

    public void delete(String documentId, String subjectId) {
        if (repository.deleteByIdAndSubjectId(documentId, subjectId) == 0) {
            throw new NotFoundException("Document not found");
        }
        log.info("Deleted document {} of {}", documentId, subjectId);
    }
}

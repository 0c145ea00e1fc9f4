package com.complypilot.controller;

import com.complypilot.model.DocumentAnalysisResult;
import com.complypilot.model.PolicyDocument;
import com.complypilot.model.User;
import com.complypilot.orchestrator.DocumentAnalysisOrchestrator;
import com.complypilot.service.DocumentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for policy document upload and compliance analysis.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private static final Logger log = LoggerFactory.getLogger(DocumentController.class);

    private final DocumentService documentService;
    private final DocumentAnalysisOrchestrator orchestrator;

    public DocumentController(DocumentService documentService, DocumentAnalysisOrchestrator orchestrator) {
        this.documentService = documentService;
        this.orchestrator = orchestrator;
    }

    /**
     * Stores a policy document for later analysis.
     *
     * <p>Endpoint: POST /api/documents/upload
     * <p>Content-Type: multipart/form-data
     * <p>Parameter: file (PDF, TXT, DOC or DOCX)
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public PolicyDocument upload(@CurrentUser User user, @RequestParam("file") MultipartFile file) throws IOException {
        log.info("Received upload '{}' ({}, {} bytes) from {}", file.getOriginalFilename(),
                file.getContentType(), file.getSize(), user.userId());
        return documentService.upload(user.userId(), file.getOriginalFilename(), file.getContentType(), file.getBytes());
    }

    @GetMapping
    public Map<String, List<PolicyDocument>> list(@CurrentUser User user) {
        return Map.of("documents", documentService.list(user.userId()));
    }

    @GetMapping("/{documentId}")
    public PolicyDocument get(@CurrentUser User user, @PathVariable String documentId) {
        return documentService.get(documentId, user.userId());
    }

    /**
     * Runs the GDPR / Cyber Essentials gap analysis. The request thread is released while
     * the analyzer works.
     *
     * <p>Endpoint: POST /api/documents/{documentId}/analyze
     */
    @PostMapping("/{documentId}/analyze")
    public CompletableFuture<DocumentAnalysisResult> analyze(@CurrentUser User user, @PathVariable String documentId) {
        return orchestrator.analyze(documentId, user.userId());
    }

    @DeleteMapping("/{documentId}")
    public Map<String, String> delete(@CurrentUser User user, @PathVariable String documentId) {
        documentService.delete(documentId, user.userId());
        return Map.of("message", "Document deleted successfully");
    }
}

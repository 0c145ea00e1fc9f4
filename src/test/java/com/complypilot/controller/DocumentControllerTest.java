package com.complypilot.controller;

import com.complypilot.exception.AnalysisFailedException;
import com.complypilot.exception.InvalidInputException;
import com.complypilot.exception.NotFoundException;
import com.complypilot.exception.UnauthenticatedException;
import com.complypilot.model.AnalysisStatus;
import com.complypilot.model.ComplianceAnalysis;
import com.complypilot.model.DocumentAnalysisResult;
import com.complypilot.model.PolicyDocument;
import com.complypilot.model.User;
import com.complypilot.orchestrator.DocumentAnalysisOrchestrator;
import com.complypilot.service.DocumentService;
import com.complypilot.service.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DocumentController.class)
class DocumentControllerTest {

    private static final User USER = new User("user_1", "owner@shop.co.uk", "Owner", null,
            null, null, null, null, Instant.EPOCH);
    private static final Instant CREATED = Instant.parse("2026-04-14T08:30:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionService sessionService;

    @MockitoBean
    private DocumentService documentService;

    @MockitoBean
    private DocumentAnalysisOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        when(sessionService.authenticate(isNull())).thenThrow(new UnauthenticatedException("Not authenticated"));
        when(sessionService.authenticate("tok")).thenReturn(USER);
    }

    @Test
    void requestsWithoutSessionAreRejected() throws Exception {
        mockMvc.perform(get("/api/documents"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Not authenticated"));
        verifyNoInteractions(documentService);
    }

    @Test
    void uploadReturnsPendingDocumentWithoutContent() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "privacy.pdf", "application/pdf", new byte[]{1, 2, 3});
        when(documentService.upload("user_1", "privacy.pdf", "application/pdf", new byte[]{1, 2, 3}))
                .thenReturn(pending("doc-1"));

        mockMvc.perform(multipart("/api/documents/upload").file(file)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("doc-1"))
                .andExpect(jsonPath("$.analysis_status").value("pending"))
                .andExpect(jsonPath("$.file_type").value("application/pdf"))
                .andExpect(jsonPath("$.content").doesNotExist());
    }

    @Test
    void uploadOfImageIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "logo.png", "image/png", new byte[]{1});
        when(documentService.upload(eq("user_1"), eq("logo.png"), eq("image/png"), any()))
                .thenThrow(new InvalidInputException("Invalid file type. Please upload PDF, TXT, DOC, or DOCX files."));

        mockMvc.perform(multipart("/api/documents/upload").file(file)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid file type. Please upload PDF, TXT, DOC, or DOCX files."));
    }

    @Test
    void oversizedUploadIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "scan.pdf", "application/pdf", new byte[]{1});
        when(documentService.upload(eq("user_1"), eq("scan.pdf"), eq("application/pdf"), any()))
                .thenThrow(new MaxUploadSizeExceededException(DocumentService.MAX_CONTENT_BYTES));

        mockMvc.perform(multipart("/api/documents/upload").file(file)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("File too large. Maximum size is 15 MB."));
    }

    @Test
    void uploadWithoutFileIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/documents/upload").header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void listWrapsDocuments() throws Exception {
        when(documentService.list("user_1")).thenReturn(List.of(pending("doc-2"), pending("doc-1")));

        mockMvc.perform(get("/api/documents").header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documents.length()").value(2))
                .andExpect(jsonPath("$.documents[0].id").value("doc-2"));
    }

    @Test
    void unknownDocumentIsNotFound() throws Exception {
        when(documentService.get("missing", "user_1")).thenThrow(new NotFoundException("Document not found"));

        mockMvc.perform(get("/api/documents/missing").header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Document not found"));
    }

    @Test
    void analyzeReturnsStructuredResult() throws Exception {
        ComplianceAnalysis analysis = new ComplianceAnalysis("Privacy Policy", "Fair",
                new ComplianceAnalysis.FrameworkCompliance(70, "partial", null, null, null),
                new ComplianceAnalysis.FrameworkCompliance(0, "not-applicable", null, null, null),
                null, "Low exposure");
        when(orchestrator.analyze("doc-1", "user_1")).thenReturn(CompletableFuture.completedFuture(
                new DocumentAnalysisResult("doc-1", "privacy.pdf", analysis, CREATED)));

        MvcResult pending = mockMvc.perform(post("/api/documents/doc-1/analyze")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.document_id").value("doc-1"))
                .andExpect(jsonPath("$.analysis.document_type").value("Privacy Policy"))
                .andExpect(jsonPath("$.analysis.gdpr_compliance.score").value(70))
                .andExpect(jsonPath("$.analysis.cyber_essentials_compliance.status").value("not-applicable"));
    }

    @Test
    void failedAnalysisIsServerError() throws Exception {
        when(orchestrator.analyze("doc-1", "user_1")).thenReturn(CompletableFuture.failedFuture(
                new AnalysisFailedException("Analysis failed: upstream timeout", null)));

        MvcResult pending = mockMvc.perform(post("/api/documents/doc-1/analyze")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Analysis failed: upstream timeout"));
    }

    @Test
    void analyzeOfUnknownDocumentIsNotFound() throws Exception {
        when(orchestrator.analyze("missing", "user_1")).thenThrow(new NotFoundException("Document not found"));

        mockMvc.perform(post("/api/documents/missing/analyze").header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteConfirms() throws Exception {
        mockMvc.perform(delete("/api/documents/doc-1").header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Document deleted successfully"));
        verify(documentService).delete("doc-1", "user_1");
    }

    private static PolicyDocument pending(String id) {
        return new PolicyDocument(id, "user_1", "privacy.pdf", "application/pdf", 3, new byte[]{1, 2, 3},
                AnalysisStatus.PENDING, null, null, CREATED, null);
    }
}

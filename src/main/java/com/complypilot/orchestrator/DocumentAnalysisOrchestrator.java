package com.complypilot.orchestrator;

import com.complypilot.agent.ComplianceAnalyzer;
import com.complypilot.config.ComplyPilotProperties;
import com.complypilot.exception.AnalysisFailedException;
import com.complypilot.exception.NotFoundException;
import com.complypilot.model.ComplianceAnalysis;
import com.complypilot.model.DocumentAnalysisResult;
import com.complypilot.model.PolicyDocument;
import com.complypilot.repository.PolicyDocumentRepository;
import com.complypilot.service.TextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Document analysis pipeline.
 * Pipeline:
 * 1. Load the document of the subject
 * 2. Text extraction (best effort, placeholder on failure)
 * 3. Truncation to the configured excerpt size
 * 4. Analyzer call on the analysis pool, bounded by the configured timeout; a timed-out
 *    call is interrupted
 * 5. Persist COMPLETED + result, or FAILED + error
 * <p>
 * Failures are not retried here; calling {@link #analyze} again overwrites a failed state.
 */
@Service
public class DocumentAnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DocumentAnalysisOrchestrator.class);

    public static final String EXTRACTION_PLACEHOLDER = "Unable to extract text content from document";

    private final PolicyDocumentRepository repository;
    private final TextExtractor textExtractor;
    private final ComplianceAnalyzer analyzer;
    private final ExecutorService analysisExecutor;
    private final Clock clock;
    private final int maxExcerptChars;
    private final Duration timeout;

    public DocumentAnalysisOrchestrator(PolicyDocumentRepository repository,
                                        TextExtractor textExtractor,
                                        ComplianceAnalyzer analyzer,
                                        @Qualifier("analysisExecutor") ExecutorService analysisExecutor,
                                        Clock clock,
                                        ComplyPilotProperties properties) {
        this.repository = repository;
        this.textExtractor = textExtractor;
        this.analyzer = analyzer;
        this.analysisExecutor = analysisExecutor;
        this.clock = clock;
        this.maxExcerptChars = properties.analysis().maxExcerptChars();
        this.timeout = properties.analysis().timeout();
    }

    /**
     * Analyzes a stored document. The returned future completes with the result, or
     * exceptionally with {@link AnalysisFailedException} after the failure was persisted.
     *
     * @throws NotFoundException immediately, if the subject has no such document
     */
    public CompletableFuture<DocumentAnalysisResult> analyze(String documentId, String subjectId) {
        PolicyDocument document = repository.findByIdAndSubjectId(documentId, subjectId)
                .orElseThrow(() -> new NotFoundException("Document not found"));

        log.info("Starting analysis of document {} '{}' for {}", documentId, document.filename(), subjectId);
        String excerpt = truncate(extractText(document), maxExcerptChars);

        CompletableFuture<ComplianceAnalysis> call = new CompletableFuture<>();
        Future<?> task = analysisExecutor.submit(() -> {
            try {
                call.complete(analyzer.analyze(excerpt));
            } catch (RuntimeException e) {
                call.completeExceptionally(e);
            }
        });

        return call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((analysis, error) -> {
                    if (error != null) {
                        // frees the worker, or drops the task if it is still queued
                        task.cancel(true);
                        throw fail(document, unwrap(error));
                    }
                    return complete(document, analysis);
                });
    }

    private String extractText(PolicyDocument document) {
        try {
            return textExtractor.extract(document);
        } catch (Exception e) {
            log.error("Error extracting text from document {}", document.id(), e);
            return EXTRACTION_PLACEHOLDER;
        }
    }

    private DocumentAnalysisResult complete(PolicyDocument document, ComplianceAnalysis analysis) {
        Instant analyzedAt = Instant.now(clock);
        persist(document.withAnalysisResult(analysis, analyzedAt));
        log.info("Analysis of document {} completed", document.id());
        return new DocumentAnalysisResult(document.id(), document.filename(), analysis, analyzedAt);
    }

    private AnalysisFailedException fail(PolicyDocument document, Throwable cause) {
        String message = cause instanceof TimeoutException
                ? "Analyzer did not respond within " + describe(timeout)
                : String.valueOf(cause.getMessage());
        log.error("Error analyzing document {}: {}", document.id(), message, cause);
        persist(document.withAnalysisFailure(message));
        return new AnalysisFailedException("Analysis failed: " + message, cause);
    }

    private void persist(PolicyDocument document) {
        // a concurrent delete wins over a late analysis outcome
        if (!repository.existsById(document.id())) {
            log.warn("Document {} was deleted during analysis, outcome discarded", document.id());
            return;
        }
        repository.save(document);
    }

    static String truncate(String text, int maxChars) {
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }

    static String describe(Duration duration) {
        long millis = duration.toMillis();
        return millis % 1000 == 0 ? millis / 1000 + "s" : millis + "ms";
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}

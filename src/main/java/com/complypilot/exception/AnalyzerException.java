package com.complypilot.exception;

/**
 * Raised by analyzer implementations for transport errors, empty replies and replies
 * that do not match the analysis schema. Converted to {@link AnalysisFailedException}
 * by the orchestrator.
 */
public class AnalyzerException extends RuntimeException {

    public AnalyzerException(String message) {
        super(message);
    }

    public AnalyzerException(String message, Throwable cause) {
        super(message, cause);
    }
}

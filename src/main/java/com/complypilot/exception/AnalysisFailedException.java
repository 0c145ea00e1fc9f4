package com.complypilot.exception;

/**
 * The external analyzer failed, timed out or replied outside the expected schema.
 * The failure is persisted on the document before this is thrown.
 */
public class AnalysisFailedException extends ComplyPilotException {

    public AnalysisFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.complypilot.exception;

/**
 * Base class of the errors surfaced to API callers.
 */
public abstract class ComplyPilotException extends RuntimeException {

    protected ComplyPilotException(String message) {
        super(message);
    }

    protected ComplyPilotException(String message, Throwable cause) {
        super(message, cause);
    }
}

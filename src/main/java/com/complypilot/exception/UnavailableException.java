package com.complypilot.exception;

/** A required collaborator (identity provider) could not be reached. */
public class UnavailableException extends ComplyPilotException {

    public UnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.complypilot.exception;

/** Missing, unknown or expired session. Never retried. */
public class UnauthenticatedException extends ComplyPilotException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}

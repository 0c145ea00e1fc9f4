package com.complypilot.exception;

/** No entity (document, register, risk) exists for the requesting subject. */
public class NotFoundException extends ComplyPilotException {

    public NotFoundException(String message) {
        super(message);
    }
}

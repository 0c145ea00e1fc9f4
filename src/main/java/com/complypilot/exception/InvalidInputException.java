package com.complypilot.exception;

public class InvalidInputException extends ComplyPilotException {

    public InvalidInputException(String message) {
        super(message);
    }
}

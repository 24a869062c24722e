package com.teamflow.core.error;

/**
 * Thrown when an epic, issue or agent id is unknown.
 */
public class NotFoundException extends CoordinationException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}

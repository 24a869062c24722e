package com.teamflow.core.error;

/**
 * Thrown by event handlers for an event that is older than the state it targets.
 * The inbound queue drops these events; they never reach a caller.
 */
public class StaleEventException extends CoordinationException {

    public StaleEventException(String message) {
        super(message);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}

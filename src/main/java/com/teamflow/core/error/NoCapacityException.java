package com.teamflow.core.error;

/**
 * Thrown when no agent is eligible for an issue. Callers may scale the pool or requeue.
 */
public class NoCapacityException extends CoordinationException {

    public NoCapacityException(String message) {
        super(message);
    }

    public NoCapacityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}

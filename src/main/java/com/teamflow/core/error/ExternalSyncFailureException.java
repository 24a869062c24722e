package com.teamflow.core.error;

/**
 * Thrown when the issue tracker cannot be reached or rejects a request.
 */
public class ExternalSyncFailureException extends CoordinationException {

    public ExternalSyncFailureException(String message) {
        super(message);
    }

    public ExternalSyncFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}

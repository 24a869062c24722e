package com.teamflow.core.error;

/**
 * Thrown when an epic update names an expected version that is no longer current.
 */
public class VersionConflictException extends CoordinationException {

    public VersionConflictException(String message) {
        super(message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}

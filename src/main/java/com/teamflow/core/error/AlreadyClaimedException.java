package com.teamflow.core.error;

/**
 * Thrown when an issue was claimed by someone else since the candidate list was built.
 */
public class AlreadyClaimedException extends CoordinationException {

    public AlreadyClaimedException(String message) {
        super(message);
    }

    public AlreadyClaimedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}

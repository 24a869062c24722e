package com.teamflow.core.error;

/**
 * Thrown when the per-issue claim lock could not be acquired in time.
 */
public class LockTimeoutException extends CoordinationException {

    public LockTimeoutException(String message) {
        super(message);
    }

    public LockTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}

package com.teamflow.core.error;

/**
 * Root of all coordination failures. Callers decide whether to retry from {@link #retryable()}.
 */
public abstract class CoordinationException extends RuntimeException {

    protected CoordinationException(String message) {
        super(message);
    }

    protected CoordinationException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether repeating the operation (usually with fresh state) may succeed. */
    public abstract boolean retryable();
}

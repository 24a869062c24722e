package com.teamflow.core.error;

/**
 * Thrown when no reviewer qualifies for an issue; the review must go to a human.
 */
public class ReviewerUnavailableException extends CoordinationException {

    public ReviewerUnavailableException(String message) {
        super(message);
    }

    public ReviewerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}

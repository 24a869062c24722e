package com.teamflow.core.persistence;

/**
 * Thrown when the context store cannot read or write an entry.
 */
public class ContextStoreException extends RuntimeException {

    public ContextStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.teamflow.core.sync;

/**
 * Outcome of a conditional fetch. When {@code notModified} is true {@code value} is null.
 */
public record FetchResult<T>(T value, String etag, boolean notModified) {

    public static <T> FetchResult<T> fresh(T value, String etag) {
        return new FetchResult<>(value, etag, false);
    }

    public static <T> FetchResult<T> unchanged(String etag) {
        return new FetchResult<>(null, etag, true);
    }
}

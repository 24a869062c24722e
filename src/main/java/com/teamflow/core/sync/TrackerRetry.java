package com.teamflow.core.sync;

import com.teamflow.core.error.CoordinationException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Builds the {@link Retry} used for tracker calls: bounded attempts, doubling backoff,
 * and only retryable {@link CoordinationException}s are retried. Anything else is rethrown at once.
 */
public final class TrackerRetry {

    private static final Logger log = LoggerFactory.getLogger(TrackerRetry.class);

    static final double BACKOFF_MULTIPLIER = 2.0;

    private TrackerRetry() {
    }

    public static Retry create(String name, int maxAttempts, Duration initialBackoff) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(backoff(initialBackoff))
                .retryOnException(TrackerRetry::isRetryable)
                .build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> log.warn("{} call failed (attempt {}/{}), retrying in {}ms: {}",
                event.getName(), event.getNumberOfRetryAttempts(), config.getMaxAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
        return retry;
    }

    /** Exponential backoff starting at {@code initial}; resilience4j needs at least one millisecond. */
    static IntervalFunction backoff(Duration initial) {
        long millis = Math.max(1L, initial == null ? 1L : initial.toMillis());
        return IntervalFunction.ofExponentialBackoff(millis, BACKOFF_MULTIPLIER);
    }

    static boolean isRetryable(Throwable e) {
        return e instanceof CoordinationException ce && ce.retryable();
    }
}

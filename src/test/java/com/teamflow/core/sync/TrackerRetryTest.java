package com.teamflow.core.sync;

import com.teamflow.core.error.ExternalSyncFailureException;
import com.teamflow.core.error.LockTimeoutException;
import com.teamflow.core.error.NotFoundException;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TrackerRetryTest {

    private final Retry retry = TrackerRetry.create("tracker", 3, Duration.ofMillis(1));

    @Test
    @DisplayName("Retryable failures are retried until the call succeeds")
    void retriesUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = retry.executeSupplier(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new ExternalSyncFailureException("HTTP 502");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(1, retry.getMetrics().getNumberOfSuccessfulCallsWithRetryAttempt());
    }

    @Test
    @DisplayName("The last failure is rethrown once attempts run out")
    void givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        var e = assertThrows(ExternalSyncFailureException.class, () -> retry.executeRunnable(() -> {
            calls.incrementAndGet();
            throw new ExternalSyncFailureException("down");
        }));

        assertEquals("down", e.getMessage());
        assertEquals(3, calls.get());
        assertEquals(1, retry.getMetrics().getNumberOfFailedCallsWithRetryAttempt());
    }

    @Test
    @DisplayName("Non-retryable coordination failures are not retried")
    void nonRetryableFailsFast() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(NotFoundException.class, () -> retry.executeRunnable(() -> {
            calls.incrementAndGet();
            throw new NotFoundException("issue-9");
        }));

        assertEquals(1, calls.get());
        assertEquals(1, retry.getMetrics().getNumberOfFailedCallsWithoutRetryAttempt());
    }

    @Test
    @DisplayName("Unrelated runtime exceptions propagate untouched")
    void otherExceptionsPropagate() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> retry.executeRunnable(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        }));

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Backoff doubles with every attempt")
    void backoffDoubles() {
        var backoff = TrackerRetry.backoff(Duration.ofMillis(100));

        assertEquals(100L, backoff.apply(1).longValue());
        assertEquals(200L, backoff.apply(2).longValue());
        assertEquals(400L, backoff.apply(3).longValue());
    }

    @Test
    void retryableClassification() {
        assertTrue(TrackerRetry.isRetryable(new ExternalSyncFailureException("x")));
        assertTrue(TrackerRetry.isRetryable(new LockTimeoutException("issue-1 busy")));
        assertFalse(TrackerRetry.isRetryable(new NotFoundException("x")));
        assertFalse(TrackerRetry.isRetryable(new IllegalArgumentException("x")));
    }

    @Test
    @DisplayName("Zero attempts and zero backoff are raised to the smallest usable values")
    void clampsDegenerateSettings() {
        Retry single = TrackerRetry.create("tracker", 0, Duration.ZERO);

        assertEquals(1, single.getRetryConfig().getMaxAttempts());
        assertEquals(1L, TrackerRetry.backoff(Duration.ZERO).apply(1).longValue());
    }
}

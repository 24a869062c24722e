package com.teamflow.core.coordinator;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.error.LockTimeoutException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-issue mutual exclusion for claim negotiation.
 * <p>
 * Acquisition waits at most the configured lock timeout. The returned handle
 * releases the lock on {@code close()}, so callers hold it in try-with-resources.
 */
@Service
public class IssueLockManager {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    @Autowired
    public IssueLockManager(TeamflowProperties properties) {
        this(properties.getCoordinator().getLockTimeout());
    }

    IssueLockManager(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * @throws LockTimeoutException if the lock is not acquired in time or the wait is interrupted
     */
    public LockHandle acquire(String issueId) {
        ReentrantLock lock = locks.computeIfAbsent(issueId, k -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException("Interrupted waiting for lock on issue " + issueId, e);
        }
        if (!acquired) {
            throw new LockTimeoutException("Timed out after " + timeout.toMillis() + "ms waiting for lock on issue " + issueId);
        }
        return new LockHandle(issueId, lock);
    }

    public boolean isLocked(String issueId) {
        ReentrantLock lock = locks.get(issueId);
        return lock != null && lock.isLocked();
    }

    public static final class LockHandle implements AutoCloseable {

        private final String issueId;
        private final ReentrantLock lock;
        private boolean released;

        private LockHandle(String issueId, ReentrantLock lock) {
            this.issueId = issueId;
            this.lock = lock;
        }

        public String issueId() {
            return issueId;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}

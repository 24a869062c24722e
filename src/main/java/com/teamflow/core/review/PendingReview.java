package com.teamflow.core.review;

import com.teamflow.core.model.AutomatedCheck;

import java.time.Instant;
import java.util.List;

/**
 * A review waiting for the reviewer's manual scores.
 *
 * @param attempts manual submissions that ended inconclusive so far
 */
public record PendingReview(
    String issueId,
    String epicId,
    String authorId,
    String reviewerId,
    List<AutomatedCheck> checks,
    int attempts,
    Instant startedAt
) {

    public PendingReview {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    PendingReview retried() {
        return new PendingReview(issueId, epicId, authorId, reviewerId, checks, attempts + 1, startedAt);
    }
}

package com.teamflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Immutable outcome of one review of an issue. A re-review produces a new record.
 *
 * @param id          record id
 * @param issueId     reviewed issue
 * @param reviewerId  reviewer agent, null when no reviewer could be selected
 * @param authorId    author agent
 * @param checks      automated check results
 * @param manual      reviewer sub-scores, null when checks short-circuited the review
 * @param decision    final decision
 * @param reason      human-readable reason
 * @param attempts    manual review attempts consumed
 * @param startedAt   when the review started
 * @param decidedAt   when the decision was reached
 */
public record ReviewRecord(
    String id,
    String issueId,
    String reviewerId,
    String authorId,
    List<AutomatedCheck> checks,
    ManualReview manual,
    ReviewDecision decision,
    String reason,
    int attempts,
    Instant startedAt,
    Instant decidedAt
) implements Serializable {

    public ReviewRecord {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }
}

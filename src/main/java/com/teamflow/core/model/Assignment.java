package com.teamflow.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Binding of an agent to an issue. At most one open (non-closed) assignment exists per issue.
 */
public record Assignment(
    String id,
    String issueId,
    String epicId,
    String agentId,
    double score,
    ScoreBreakdown breakdown,
    Instant claimedAt,
    Instant closedAt,
    AssignmentOutcome outcome
) implements Serializable {

    public boolean isOpen() {
        return closedAt == null;
    }

    public Assignment close(AssignmentOutcome how, Instant at) {
        return new Assignment(id, issueId, epicId, agentId, score, breakdown, claimedAt, at, how);
    }
}

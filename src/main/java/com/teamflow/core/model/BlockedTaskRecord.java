package com.teamflow.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * A stalled in-flight issue tracked by the stall detector.
 * <p>
 * Advanced only through {@link #advance}, deleted on recovery.
 *
 * @param issueId        stalled issue
 * @param epicId         epic of the issue
 * @param agentId        agent that was working on it when it stalled
 * @param stallDuration  time since last activity at the latest detection
 * @param reason         classified cause
 * @param stage          current escalation rung
 * @param detectedAt     first detection
 * @param lastEscalatedAt latest stage change
 * @param note           outcome of the latest ladder action, nullable
 */
public record BlockedTaskRecord(
    String issueId,
    String epicId,
    String agentId,
    Duration stallDuration,
    StallReason reason,
    EscalationStage stage,
    Instant detectedAt,
    Instant lastEscalatedAt,
    String note
) implements Serializable {

    public static BlockedTaskRecord detected(Issue issue, Duration stall, StallReason reason, Instant at) {
        return new BlockedTaskRecord(issue.id(), issue.epicId(), issue.assigneeId(), stall, reason,
                EscalationStage.DETECTED, at, at, null);
    }

    /** An issue whose review was escalated: it starts at the last rung, so the ladder leaves it alone. */
    public static BlockedTaskRecord reviewEscalated(Issue issue, String why, Instant at) {
        return new BlockedTaskRecord(issue.id(), issue.epicId(), issue.assigneeId(), Duration.ZERO,
                StallReason.REVIEW_UNRESOLVED, EscalationStage.ESCALATED_TO_HUMAN, at, at, why);
    }

    public int level() {
        return stage.level();
    }

    public BlockedTaskRecord advance(Duration stall, Instant at, String outcome) {
        return new BlockedTaskRecord(issueId, epicId, agentId, stall, reason, stage.next(), detectedAt, at, outcome);
    }

    public BlockedTaskRecord observed(Duration stall) {
        return new BlockedTaskRecord(issueId, epicId, agentId, stall, reason, stage, detectedAt, lastEscalatedAt, note);
    }
}

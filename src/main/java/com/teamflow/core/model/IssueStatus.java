package com.teamflow.core.model;

/**
 * Lifecycle status of an issue.
 * <p>
 * Happy path: OPEN → CLAIMED → IN_PROGRESS → IN_REVIEW → APPROVED → DONE.
 * A review may send the issue to CHANGES_REQUESTED, from which the assignee
 * resumes IN_PROGRESS. CLOSED means the issue was closed on the tracker and
 * any in-flight outcome for it must be discarded.
 */
public enum IssueStatus {
    OPEN,
    CLAIMED,
    IN_PROGRESS,
    IN_REVIEW,
    APPROVED,
    CHANGES_REQUESTED,
    DONE,
    CLOSED;

    public boolean isTerminal() {
        return this == DONE || this == CLOSED;
    }

    /** Statuses the stall detector watches. */
    public boolean isInFlight() {
        return this == IN_PROGRESS || this == IN_REVIEW;
    }
}

package com.teamflow.core.model;

public enum StallReason {
    NO_ACTIVITY,
    ERROR_THRESHOLD,
    DEPENDENCY_WAIT,
    RESOURCE_EXHAUSTION,
    /** A reviewer could not reach a decision and the issue went to a human. */
    REVIEW_UNRESOLVED
}

package com.teamflow.core.model;

public enum AssignmentOutcome {
    COMPLETED,
    REASSIGNED,
    CANCELLED
}

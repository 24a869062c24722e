package com.teamflow.core.model;

public enum ReviewDecision {
    APPROVED,
    CHANGES_REQUESTED,
    ESCALATED
}

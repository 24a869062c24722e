package com.teamflow.core.model;

public enum RiskFlag {
    STALLED_WORK,
    HUMAN_ESCALATION,
    DEPENDENCY_BOTTLENECK,
    LOW_VELOCITY
}

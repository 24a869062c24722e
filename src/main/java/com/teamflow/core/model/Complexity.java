package com.teamflow.core.model;

public enum Complexity {
    LOW,
    MEDIUM,
    HIGH
}

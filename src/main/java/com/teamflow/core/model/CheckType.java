package com.teamflow.core.model;

public enum CheckType {
    LINT,
    TESTS,
    SECURITY,
    COVERAGE
}

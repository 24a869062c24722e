package com.teamflow.core.model;

/**
 * Class of an epic-level decision put to a consensus vote.
 */
public enum DecisionClass {
    STANDARD,
    CRITICAL
}

package com.teamflow.core.model;

/**
 * Issue priority. Drives the stall threshold used by the stall detector.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}

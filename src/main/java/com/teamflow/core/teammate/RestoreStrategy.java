package com.teamflow.core.teammate;

import java.util.Locale;

/**
 * How much of a saved epic context is loaded back.
 */
public enum RestoreStrategy {
    /** Epic, issues, assignments, reviews and stall records. */
    FULL,
    /** Epic and a progress summary computed from the saved issues. */
    SUMMARY,
    /** Epic plus the issues (and their assignments) held by one agent. */
    SELECTIVE;

    public static RestoreStrategy parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

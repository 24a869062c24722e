package com.teamflow.core.teammate;

/**
 * @param enabled           teammate mode is on
 * @param epics             epics that are not archived
 * @param agents            registered agents
 * @param activeAssignments open assignments across all epics
 * @param trackerConfigured an issue tracker is configured
 */
public record TeammateStatus(
    boolean enabled,
    int epics,
    int agents,
    int activeAssignments,
    boolean trackerConfigured
) {}

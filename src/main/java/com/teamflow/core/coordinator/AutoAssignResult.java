package com.teamflow.core.coordinator;

/**
 * Per-issue outcome of an auto-assign pass.
 *
 * @param agentId assigned agent, null unless {@code outcome} is ASSIGNED
 * @param detail  failure detail, null when assigned
 */
public record AutoAssignResult(String issueId, Outcome outcome, String agentId, String detail) {

    public enum Outcome { ASSIGNED, NO_CAPACITY, CONTENTION }
}

package com.teamflow.core.events;

/**
 * Event type names published on the {@link EventBus}.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String EPIC_TRANSITIONED = "epic.transitioned";
    public static final String EPIC_BLOCKED = "epic.blocked";
    public static final String ISSUE_CLAIMED = "issue.claimed";
    public static final String ISSUE_PROGRESS = "issue.progress";
    public static final String ISSUE_COMPLETED = "issue.completed";
    public static final String ISSUE_UNBLOCKED = "issue.unblocked";
    public static final String REVIEW_DECIDED = "review.decided";
    public static final String REVIEW_RETRY_REQUESTED = "review.retry_requested";
    public static final String STALL_DETECTED = "stall.detected";
    public static final String STALL_ESCALATED = "stall.escalated";
    public static final String AGENT_STATUS_REQUESTED = "agent.status_requested";
    public static final String AGENT_RESTART_REQUESTED = "agent.restart_requested";
    public static final String AGENT_FREE_RESOURCES_REQUESTED = "agent.free_resources_requested";
    public static final String AGENT_WAKE_REQUESTED = "agent.wake_requested";
    public static final String CAPACITY_EXHAUSTED = "capacity.exhausted";
}

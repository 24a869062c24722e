package com.teamflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A coordination event (claims, transitions, review decisions, stall escalations, agent prompts).
 *
 * @param eventType event type (e.g. "issue.claimed", "stall.escalated", "agent.wake_requested")
 * @param epicId    the epic this event belongs to
 * @param issueId   the issue this event relates to (nullable for epic-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record TeamflowEvent(
    String eventType,
    String epicId,
    String issueId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public TeamflowEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static TeamflowEvent of(String eventType, String epicId, String issueId, Map<String, Object> payload) {
        return new TeamflowEvent(eventType, epicId, issueId, payload, Instant.now());
    }
}

package com.teamflow.core.sync;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Maps webhook payloads and poll results onto {@link TrackerEvent}, so both delivery modes
 * feed the same queue.
 */
@Component
public class TrackerEventNormalizer {

    private final Clock clock;

    public TrackerEventNormalizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Normalizes a GitHub {@code issues} webhook delivery.
     *
     * @param deliveryId value of the {@code X-GitHub-Delivery} header, nullable
     * @param eventName  value of the {@code X-GitHub-Event} header
     * @return empty for events and actions that do not concern issues
     */
    public Optional<TrackerEvent> fromWebhook(String deliveryId, String eventName, JsonNode payload) {
        if (!"issues".equals(eventName) || payload == null || !payload.hasNonNull("issue")) {
            return Optional.empty();
        }
        JsonNode issueNode = payload.get("issue");
        if (issueNode.has("pull_request")) {
            return Optional.empty();
        }
        String action = payload.path("action").asText("");
        TrackerEvent.Type type = switch (action) {
            case "opened" -> TrackerEvent.Type.CREATED;
            case "edited", "reopened" -> TrackerEvent.Type.EDITED;
            case "closed" -> TrackerEvent.Type.CLOSED;
            case "labeled", "unlabeled" -> TrackerEvent.Type.LABELED;
            case "assigned", "unassigned" -> TrackerEvent.Type.ASSIGNED;
            default -> null;
        };
        if (type == null) {
            return Optional.empty();
        }
        TrackerIssue issue = GitHubIssueTrackerClient.toIssue(issueNode);
        String id = deliveryId != null && !deliveryId.isBlank()
                ? deliveryId
                : "webhook:" + issue.number() + ":" + action + ":" + issue.updatedAt();
        return Optional.of(new TrackerEvent(id, type, issue, null, "webhook", clock.instant()));
    }

    /**
     * Normalizes a polled issue.
     *
     * @param known    whether a local issue already exists for this number
     * @param epicHint epic new issues are filed under, nullable
     */
    public TrackerEvent fromPoll(TrackerIssue issue, boolean known, String epicHint) {
        TrackerEvent.Type type = issue.isClosed() ? TrackerEvent.Type.CLOSED
                : known ? TrackerEvent.Type.EDITED : TrackerEvent.Type.CREATED;
        return new TrackerEvent("poll:" + issue.number() + ":" + issue.updatedAt(), type, issue, epicHint,
                "poll", clock.instant());
    }
}

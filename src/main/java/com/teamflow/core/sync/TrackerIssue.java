package com.teamflow.core.sync;

import java.time.Instant;
import java.util.List;

/**
 * Issue as seen on the tracker.
 *
 * @param number    tracker issue number
 * @param title     title
 * @param body      body text, never null
 * @param state     "open" or "closed"
 * @param labels    label names
 * @param assignees assignee logins
 * @param updatedAt last tracker-side update
 */
public record TrackerIssue(
    int number,
    String title,
    String body,
    String state,
    List<String> labels,
    List<String> assignees,
    Instant updatedAt
) {

    public TrackerIssue {
        body = body == null ? "" : body;
        labels = labels == null ? List.of() : List.copyOf(labels);
        assignees = assignees == null ? List.of() : List.copyOf(assignees);
    }

    public boolean isClosed() {
        return "closed".equalsIgnoreCase(state);
    }
}

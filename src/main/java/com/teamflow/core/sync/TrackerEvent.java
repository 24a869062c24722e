package com.teamflow.core.sync;

import java.time.Instant;

/**
 * Tracker change normalized from either delivery mode.
 *
 * @param eventId    delivery id (webhook) or issue number plus update time (poll), used for dedupe
 * @param type       what happened
 * @param issue      tracker-side issue state carried by the event
 * @param epicHint   epic to file new issues under when no {@code epic:} label says otherwise, nullable
 * @param source     "webhook" or "poll"
 * @param receivedAt when the event entered the queue
 */
public record TrackerEvent(
    String eventId,
    Type type,
    TrackerIssue issue,
    String epicHint,
    String source,
    Instant receivedAt
) {

    public enum Type { CREATED, EDITED, CLOSED, LABELED, ASSIGNED }

    public int issueNumber() {
        return issue.number();
    }
}

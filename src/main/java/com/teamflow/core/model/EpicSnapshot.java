package com.teamflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Full context of an epic as saved to (and restored from) the context store.
 *
 * @param epic        the epic
 * @param issues      its issues
 * @param assignments assignment history, open ones included
 * @param reviews     review records
 * @param blocked     live stall records
 * @param savedBy     agent that requested the save, nullable
 * @param savedAt     save time
 */
public record EpicSnapshot(
    Epic epic,
    List<Issue> issues,
    List<Assignment> assignments,
    List<ReviewRecord> reviews,
    List<BlockedTaskRecord> blocked,
    String savedBy,
    Instant savedAt
) implements Serializable {

    public EpicSnapshot {
        issues = issues == null ? List.of() : List.copyOf(issues);
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        reviews = reviews == null ? List.of() : List.copyOf(reviews);
        blocked = blocked == null ? List.of() : List.copyOf(blocked);
    }
}

package com.teamflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;

/**
 * A unit of work inside an epic.
 * <p>
 * Status is only changed by the task coordinator and the peer review engine.
 *
 * @param id             unique identifier (e.g. "issue-43")
 * @param epicId         parent epic
 * @param number         tracker issue number, nullable for locally created issues
 * @param title          title
 * @param description    body text
 * @param requirements   structured requirements (capabilities, priority, dependencies)
 * @param status         lifecycle status
 * @param assigneeId     current assignee, nullable
 * @param claimedAt      when the current assignee claimed it, nullable
 * @param lastActivityAt last observed activity, nullable until claimed
 * @param completedAt    when it reached DONE, nullable
 * @param trackerUpdatedAt tracker-side "updated_at" used for freshness checks, nullable
 */
public record Issue(
    String id,
    String epicId,
    Integer number,
    String title,
    String description,
    WorkRequirements requirements,
    IssueStatus status,
    String assigneeId,
    Instant claimedAt,
    Instant lastActivityAt,
    Instant completedAt,
    Instant trackerUpdatedAt
) implements Serializable {

    public Issue {
        requirements = requirements == null ? WorkRequirements.none() : requirements;
        status = status == null ? IssueStatus.OPEN : status;
        description = description == null ? "" : description;
    }

    public static Issue open(String id, String epicId, Integer number, String title, WorkRequirements requirements) {
        return new Issue(id, epicId, number, title, "", requirements, IssueStatus.OPEN,
                null, null, null, null, null);
    }

    public Priority priority() {
        return requirements.priority();
    }

    public Set<String> dependencies() {
        return requirements.dependencies();
    }

    public Issue withStatus(IssueStatus newStatus) {
        return new Issue(id, epicId, number, title, description, requirements, newStatus,
                assigneeId, claimedAt, lastActivityAt, completedAt, trackerUpdatedAt);
    }

    public Issue claimedBy(String agentId, Instant at) {
        return new Issue(id, epicId, number, title, description, requirements, IssueStatus.CLAIMED,
                agentId, at, at, completedAt, trackerUpdatedAt);
    }

    public Issue released() {
        return new Issue(id, epicId, number, title, description, requirements, IssueStatus.OPEN,
                null, null, lastActivityAt, completedAt, trackerUpdatedAt);
    }

    public Issue withActivity(Instant at) {
        return new Issue(id, epicId, number, title, description, requirements, status,
                assigneeId, claimedAt, at, completedAt, trackerUpdatedAt);
    }

    public Issue completed(Instant at) {
        return new Issue(id, epicId, number, title, description, requirements, IssueStatus.DONE,
                assigneeId, claimedAt, at, at, trackerUpdatedAt);
    }

    public Issue withContent(String newTitle, String newDescription, WorkRequirements newRequirements,
                             Instant newTrackerUpdatedAt) {
        return new Issue(id, epicId, number, newTitle, newDescription, newRequirements, status,
                assigneeId, claimedAt, lastActivityAt, completedAt, newTrackerUpdatedAt);
    }
}

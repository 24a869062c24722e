package com.teamflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A long-lived project container grouping related issues.
 * <p>
 * Instances are immutable; the epic state machine replaces the stored value on
 * every mutation and bumps {@link #version()} by exactly one.
 *
 * @param id              unique identifier (e.g. "epic-1718000000000-1a2b3c4d")
 * @param title           short human title
 * @param description     free-form description
 * @param state           current lifecycle state
 * @param objectives      ordered objectives
 * @param constraints     constraints every issue must respect
 * @param externalRef     linked tracker issue number, nullable
 * @param version         monotonically increasing mutation counter
 * @param createdAt       creation time
 * @param updatedAt       time of the last mutation
 */
public record Epic(
    String id,
    String title,
    String description,
    EpicState state,
    List<String> objectives,
    List<String> constraints,
    Integer externalRef,
    long version,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public Epic {
        objectives = objectives == null ? List.of() : List.copyOf(objectives);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        description = description == null ? "" : description;
    }

    public Epic withState(EpicState newState, Instant at) {
        return new Epic(id, title, description, newState, objectives, constraints, externalRef, version + 1, createdAt, at);
    }

    public Epic withDetails(String newTitle, String newDescription, List<String> newObjectives,
                            List<String> newConstraints, Instant at) {
        return new Epic(id, newTitle, newDescription, state, newObjectives, newConstraints, externalRef,
                version + 1, createdAt, at);
    }

    public Epic withVersion(long newVersion) {
        return new Epic(id, title, description, state, objectives, constraints, externalRef, newVersion, createdAt, updatedAt);
    }
}

package com.teamflow.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle states of an epic and the transition table between them.
 * <p>
 * ARCHIVED is absorbing: it has no outgoing transitions.
 */
public enum EpicState {
    UNINITIALIZED,
    ACTIVE,
    PAUSED,
    BLOCKED,
    REVIEW,
    COMPLETED,
    ARCHIVED;

    private static final Map<EpicState, Set<EpicState>> TRANSITIONS = new EnumMap<>(EpicState.class);

    static {
        TRANSITIONS.put(UNINITIALIZED, EnumSet.of(ACTIVE));
        TRANSITIONS.put(ACTIVE, EnumSet.of(PAUSED, BLOCKED, REVIEW));
        TRANSITIONS.put(PAUSED, EnumSet.of(ACTIVE, ARCHIVED));
        TRANSITIONS.put(BLOCKED, EnumSet.of(ACTIVE, PAUSED));
        TRANSITIONS.put(REVIEW, EnumSet.of(ACTIVE, COMPLETED));
        TRANSITIONS.put(COMPLETED, EnumSet.of(ARCHIVED));
        TRANSITIONS.put(ARCHIVED, EnumSet.noneOf(EpicState.class));
    }

    public Set<EpicState> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(EpicState target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    /** Only an active epic accepts new assignments. */
    public boolean acceptsAssignments() {
        return this == ACTIVE;
    }
}

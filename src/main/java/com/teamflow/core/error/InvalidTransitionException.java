package com.teamflow.core.error;

import com.teamflow.core.model.EpicState;

/**
 * Thrown when an epic is asked to move to a state its current state does not allow.
 */
public class InvalidTransitionException extends CoordinationException {

    private final String epicId;
    private final EpicState from;
    private final EpicState to;

    public InvalidTransitionException(String epicId, EpicState from, EpicState to) {
        super("Epic " + epicId + " cannot move from " + from + " to " + to
                + " (allowed: " + from.allowedTargets() + ")");
        this.epicId = epicId;
        this.from = from;
        this.to = to;
    }

    public String getEpicId() { return epicId; }
    public EpicState getFrom() { return from; }
    public EpicState getTo() { return to; }

    @Override
    public boolean retryable() {
        return false;
    }
}

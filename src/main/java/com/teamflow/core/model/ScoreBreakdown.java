package com.teamflow.core.model;

import java.io.Serializable;

/**
 * Points contributed by each scoring factor. Each value is already scaled by its weight.
 */
public record ScoreBreakdown(
    double capabilityMatch,
    double performance,
    double availability,
    double specialization,
    double experience
) implements Serializable {

    public double total() {
        return capabilityMatch + performance + availability + specialization + experience;
    }
}

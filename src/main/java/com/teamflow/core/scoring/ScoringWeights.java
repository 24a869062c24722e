package com.teamflow.core.scoring;

import com.teamflow.core.config.TeamflowProperties;

/**
 * Maximum points per scoring factor. Always sums to 100.
 */
public record ScoringWeights(
    int capabilityMatch,
    int performance,
    int availability,
    int specialization,
    int experience
) {

    public static final ScoringWeights DEFAULT = new ScoringWeights(40, 20, 20, 10, 10);

    public ScoringWeights {
        int sum = capabilityMatch + performance + availability + specialization + experience;
        if (sum != 100) {
            throw new IllegalArgumentException("Scoring weights must sum to 100, got " + sum);
        }
        if (capabilityMatch < 0 || performance < 0 || availability < 0 || specialization < 0 || experience < 0) {
            throw new IllegalArgumentException("Scoring weights must not be negative");
        }
    }

    public static ScoringWeights from(TeamflowProperties.Scoring scoring) {
        return new ScoringWeights(scoring.getCapabilityWeight(), scoring.getPerformanceWeight(),
                scoring.getAvailabilityWeight(), scoring.getSpecializationWeight(), scoring.getExperienceWeight());
    }
}

package com.teamflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Sub-scores submitted by a reviewer. Each sub-score is on a 0–5 scale.
 *
 * @param codeQuality      code quality
 * @param designAlignment  alignment with the epic's design and constraints
 * @param completeness     completeness against the issue
 * @param unmetCriteria    acceptance criteria the reviewer could not confirm
 * @param comment          reviewer comment, nullable
 */
public record ManualReview(
    double codeQuality,
    double designAlignment,
    double completeness,
    List<String> unmetCriteria,
    String comment
) implements Serializable {

    public static final double MAX_SUB_SCORE = 5.0;

    public ManualReview {
        checkRange("codeQuality", codeQuality);
        checkRange("designAlignment", designAlignment);
        checkRange("completeness", completeness);
        unmetCriteria = unmetCriteria == null ? List.of() : List.copyOf(unmetCriteria);
    }

    /** Average of the three sub-scores normalized to [0, 1]. */
    public double composite() {
        return (codeQuality + designAlignment + completeness) / 3.0 / MAX_SUB_SCORE;
    }

    private static void checkRange(String name, double value) {
        if (value < 0 || value > MAX_SUB_SCORE) {
            throw new IllegalArgumentException(name + " must be between 0 and 5, got " + value);
        }
    }
}

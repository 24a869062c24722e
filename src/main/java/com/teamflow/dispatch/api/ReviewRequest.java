package com.teamflow.dispatch.api;

import com.teamflow.core.model.ManualReview;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/issues/{id}/reviews. Sub-scores are on a 0–5 scale.
 */
public record ReviewRequest(
    String reviewerId,
    double codeQuality,
    double designAlignment,
    double completeness,
    List<String> unmetCriteria,
    String comment
) {

    ManualReview toManualReview() {
        return new ManualReview(codeQuality, designAlignment, completeness, unmetCriteria, comment);
    }
}

package com.teamflow.core.sync;

import com.teamflow.core.model.WorkRequirements;

/**
 * Turns a tracker issue into structured work requirements.
 */
public interface WorkRequirementExtractor {

    WorkRequirements extract(TrackerIssue issue);
}

package com.teamflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Derived progress of an epic.
 *
 * @param epicId            epic
 * @param total             number of issues
 * @param byStatus          issue counts keyed by status
 * @param completionPercent done / total, rounded, 0 when empty
 * @param activeWork        in_progress + in_review
 * @param availableWork     open issues whose dependencies are done
 * @param blockedByDependencies open issues still waiting on dependencies
 * @param velocityPerDay    issues completed per day over the trailing window
 * @param riskFlags         raised risk flags
 * @param generatedAt       report time
 */
public record ProgressReport(
    String epicId,
    int total,
    Map<IssueStatus, Integer> byStatus,
    int completionPercent,
    int activeWork,
    int availableWork,
    int blockedByDependencies,
    double velocityPerDay,
    List<RiskFlag> riskFlags,
    Instant generatedAt
) implements Serializable {}

package com.teamflow.core.model;

import java.io.Serializable;

/**
 * Result of scoring one agent against one issue.
 *
 * @param agentId        scored agent
 * @param issueId        target issue
 * @param total          weighted total in [0, 100]
 * @param breakdown      per-factor points
 * @param confidence     confidence in [0, 1]
 * @param meetsThreshold whether total reaches the configured minimum
 */
public record AgentScore(
    String agentId,
    String issueId,
    double total,
    ScoreBreakdown breakdown,
    double confidence,
    boolean meetsThreshold
) implements Serializable {}

package com.teamflow.dispatch.api;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/agents.
 *
 * @param id                 agent id; registering a known id refreshes its profile
 * @param type               agent kind; nullable, defaults to "coder"
 * @param capabilities       tags such as "lang:java" or "jwt"
 * @param maxConcurrentTasks concurrent task cap; nullable, defaults to the configured cap
 */
public record AgentRegistrationRequest(
    String id,
    String type,
    List<String> capabilities,
    Integer maxConcurrentTasks
) {}

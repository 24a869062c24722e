package com.teamflow.dispatch.api;

import com.teamflow.core.model.AutomatedCheck;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/issues/{id}/completion.
 *
 * @param agentId the issue's assignee
 * @param checks  automated check results from CI; nullable
 */
public record CompletionRequest(String agentId, List<AutomatedCheck> checks) {}

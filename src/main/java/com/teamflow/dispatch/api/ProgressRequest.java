package com.teamflow.dispatch.api;

/**
 * Inbound JSON body for the progress and failure reports of an assignee.
 *
 * @param agentId the issue's assignee
 * @param note    progress note or failure message; nullable
 */
public record ProgressRequest(String agentId, String note) {}

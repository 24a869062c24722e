package com.teamflow.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/issues/{id}/claim.
 */
public record ClaimRequest(String agentId) {}

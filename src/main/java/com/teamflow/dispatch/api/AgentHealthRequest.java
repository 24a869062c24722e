package com.teamflow.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/agents/{id}/health. Both values are clamped to 0–1.
 */
public record AgentHealthRequest(double health, double resourceHealth) {}

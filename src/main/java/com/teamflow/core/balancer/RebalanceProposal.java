package com.teamflow.core.balancer;

public record RebalanceProposal(String issueId, String fromAgentId, String toAgentId, double score) {}

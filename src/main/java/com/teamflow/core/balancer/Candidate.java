package com.teamflow.core.balancer;

import com.teamflow.core.model.AgentProfile;
import com.teamflow.core.model.AgentScore;

/**
 * An eligible agent with its raw match score, fairness score and the blend of both.
 */
public record Candidate(AgentProfile agent, AgentScore score, double fairness, double combined) {

    public String agentId() {
        return agent.id();
    }
}

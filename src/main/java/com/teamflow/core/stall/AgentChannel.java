package com.teamflow.core.stall;

/**
 * Out-of-band signals sent to a worker agent by the escalation ladder.
 * Every call is a non-blocking prompt; the agent answers by reporting progress.
 */
public interface AgentChannel {

    void requestStatus(String agentId, String issueId, String epicId);

    void restart(String agentId, String issueId, String epicId);

    void freeResources(String agentId, String issueId, String epicId);

    void wake(String agentId, String issueId, String epicId);
}

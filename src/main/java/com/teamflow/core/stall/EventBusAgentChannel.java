package com.teamflow.core.stall;

import com.teamflow.core.events.EventBus;
import com.teamflow.core.events.EventTypes;
import com.teamflow.core.events.TeamflowEvent;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Delivers agent signals as {@code agent.*} events; agent runtimes subscribe to the bus.
 */
@Component
public class EventBusAgentChannel implements AgentChannel {

    private final EventBus eventBus;

    public EventBusAgentChannel(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void requestStatus(String agentId, String issueId, String epicId) {
        send(EventTypes.AGENT_STATUS_REQUESTED, agentId, issueId, epicId);
    }

    @Override
    public void restart(String agentId, String issueId, String epicId) {
        send(EventTypes.AGENT_RESTART_REQUESTED, agentId, issueId, epicId);
    }

    @Override
    public void freeResources(String agentId, String issueId, String epicId) {
        send(EventTypes.AGENT_FREE_RESOURCES_REQUESTED, agentId, issueId, epicId);
    }

    @Override
    public void wake(String agentId, String issueId, String epicId) {
        send(EventTypes.AGENT_WAKE_REQUESTED, agentId, issueId, epicId);
    }

    private void send(String type, String agentId, String issueId, String epicId) {
        eventBus.publish(TeamflowEvent.of(type, epicId, issueId, Map.of("agentId", agentId)));
    }
}

package com.teamflow.core.agent;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.config.TeamflowProperties.AgentDefinition;
import com.teamflow.core.model.Capability;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Registers the agents listed under {@code teamflow.agents} when the context starts.
 * Entries without an id are skipped with a warning.
 */
@Component
public class AgentPoolInitializer {

    private static final Logger log = LoggerFactory.getLogger(AgentPoolInitializer.class);

    private final TeamflowProperties properties;
    private final AgentRegistry agents;

    public AgentPoolInitializer(TeamflowProperties properties, AgentRegistry agents) {
        this.properties = properties;
        this.agents = agents;
    }

    @PostConstruct
    void init() {
        int registered = registerConfigured();
        if (registered == 0) {
            log.info("No agents configured; waiting for agents to register over the API");
        } else {
            log.info("Registered {} configured agent(s)", registered);
        }
    }

    int registerConfigured() {
        int registered = 0;
        for (AgentDefinition def : properties.getAgents()) {
            if (def.getId() == null || def.getId().isBlank()) {
                log.warn("Skipping configured agent without an id ({})", def.getCapabilities());
                continue;
            }
            agents.register(def.getId(), def.getType(), Capability.parseAll(def.getCapabilities()),
                    def.getMaxConcurrentTasks());
            registered++;
        }
        return registered;
    }
}

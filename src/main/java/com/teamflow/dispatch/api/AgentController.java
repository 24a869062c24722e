package com.teamflow.dispatch.api;

import com.teamflow.core.agent.AgentRegistry;
import com.teamflow.core.error.NotFoundException;
import com.teamflow.core.model.AgentProfile;
import com.teamflow.core.model.Capability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST surface for worker agents joining, reporting health and leaving the pool.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final AgentRegistry agents;

    public AgentController(AgentRegistry agents) {
        this.agents = agents;
    }

    /**
     * POST /api/v1/agents: registers an agent, or refreshes a known one while keeping its load.
     */
    @PostMapping
    public ResponseEntity<AgentProfile> register(@RequestBody AgentRegistrationRequest request) {
        if (request.id() == null || request.id().isBlank()) {
            throw new IllegalArgumentException("Agent id is required");
        }
        if (request.maxConcurrentTasks() != null && request.maxConcurrentTasks() < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be at least 1");
        }
        String type = request.type() == null || request.type().isBlank() ? "coder" : request.type();
        AgentProfile profile = agents.register(request.id(), type, Capability.parseAll(request.capabilities()),
                request.maxConcurrentTasks());
        return ResponseEntity.status(HttpStatus.CREATED).body(profile);
    }

    @GetMapping
    public List<AgentProfile> list() {
        return agents.all();
    }

    @GetMapping("/{agentId}")
    public AgentProfile get(@PathVariable String agentId) {
        return agents.get(agentId);
    }

    @PostMapping("/{agentId}/health")
    public AgentProfile health(@PathVariable String agentId, @RequestBody AgentHealthRequest request) {
        return agents.updateHealth(agentId, request.health(), request.resourceHealth());
    }

    @DeleteMapping("/{agentId}")
    public ResponseEntity<Void> remove(@PathVariable String agentId) {
        if (!agents.remove(agentId)) {
            throw new NotFoundException("Unknown agent: " + agentId);
        }
        log.info("Agent {} left the pool", agentId);
        return ResponseEntity.noContent().build();
    }
}

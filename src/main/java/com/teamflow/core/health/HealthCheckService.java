package com.teamflow.core.health;

import com.teamflow.core.agent.AgentRegistry;
import com.teamflow.core.persistence.ContextStore;
import com.teamflow.core.sync.TrackerSync;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ContextStore contextStore;
    private final TrackerSync trackerSync;
    private final AgentRegistry agents;

    public HealthCheckService(ContextStore contextStore, TrackerSync trackerSync, AgentRegistry agents) {
        this.contextStore = contextStore;
        this.trackerSync = trackerSync;
        this.agents = agents;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkContextStore());
        results.add(checkTracker());
        results.add(checkAgentPool());
        return results;
    }

    private HealthStatus checkContextStore() {
        String type = contextStore.getClass().getSimpleName();
        try {
            if (contextStore.isAvailable()) {
                return new HealthStatus("context-store", HealthStatus.Status.UP,
                        "Context store available", Map.of("type", type));
            }
            return new HealthStatus("context-store", HealthStatus.Status.DOWN,
                    "Context store unavailable", Map.of("type", type));
        } catch (RuntimeException e) {
            log.warn("Context store health check failed: {}", e.getMessage());
            return new HealthStatus("context-store", HealthStatus.Status.DOWN,
                    "Context store error: " + e.getMessage(), Map.of("type", type));
        }
    }

    private HealthStatus checkTracker() {
        if (!trackerSync.isConfigured()) {
            return new HealthStatus("tracker", HealthStatus.Status.DEGRADED,
                    "Issue tracker not configured; running on local state only", Map.of());
        }
        return new HealthStatus("tracker", HealthStatus.Status.UP, "Issue tracker configured", Map.of());
    }

    private HealthStatus checkAgentPool() {
        int size = agents.size();
        if (size == 0) {
            return new HealthStatus("agents", HealthStatus.Status.DEGRADED,
                    "No agents registered", Map.of("count", "0"));
        }
        return new HealthStatus("agents", HealthStatus.Status.UP,
                size + " agent(s) registered", Map.of("count", String.valueOf(size)));
    }
}

package com.teamflow.core.agent;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.error.NotFoundException;
import com.teamflow.core.model.AgentProfile;
import com.teamflow.core.model.Capability;
import com.teamflow.core.model.PerformanceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Owned table of worker agents, indexed by id.
 * <p>
 * Every mutation is an atomic replace of the agent's immutable profile, so
 * readers always see a consistent snapshot without locking.
 */
@Service
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final ConcurrentHashMap<String, AgentProfile> agents = new ConcurrentHashMap<>();
    private final AtomicLong registrationCounter = new AtomicLong();
    private final TeamflowProperties properties;
    private final Clock clock;

    public AgentRegistry(TeamflowProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Registers an agent, or refreshes type, capabilities and cap of a known one
     * while keeping its load, performance and registration order.
     *
     * @param maxConcurrentTasks cap, or null for the configured default
     */
    public AgentProfile register(String agentId, String agentType, Set<Capability> capabilities,
                                 Integer maxConcurrentTasks) {
        int cap = maxConcurrentTasks != null ? maxConcurrentTasks
                : properties.getBalancer().getDefaultMaxConcurrentTasks();
        AgentProfile profile = agents.compute(agentId, (id, existing) -> {
            if (existing == null) {
                return new AgentProfile(id, agentType, capabilities, 0.0, 1.0, 1.0,
                        PerformanceMetrics.fresh(), cap, 0, registrationCounter.incrementAndGet(), clock.instant());
            }
            return new AgentProfile(id, agentType, capabilities, existing.workload(), existing.health(),
                    existing.resourceHealth(), existing.performance(), cap, existing.activeTasks(),
                    existing.registrationOrder(), existing.registeredAt()).withActiveTasks(existing.activeTasks());
        });
        log.info("Registered agent {} ({}) with capabilities {}", agentId, agentType, capabilities);
        return profile;
    }

    public Optional<AgentProfile> find(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public AgentProfile get(String agentId) {
        return find(agentId).orElseThrow(() -> new NotFoundException("Unknown agent: " + agentId));
    }

    /** All agents in registration order. */
    public List<AgentProfile> all() {
        return agents.values().stream()
                .sorted(Comparator.comparingLong(AgentProfile::registrationOrder))
                .toList();
    }

    public int size() {
        return agents.size();
    }

    /**
     * Takes one task slot when the agent is below its cap and its workload is at most {@code maxWorkload}.
     * The check and the increment are a single atomic step on the agent's entry.
     *
     * @return false when the agent has no room; nothing changes in that case
     * @throws NotFoundException if the agent is unknown
     */
    public boolean tryReserve(String agentId, double maxWorkload) {
        AtomicBoolean reserved = new AtomicBoolean();
        update(agentId, a -> {
            if (a.atCapacity() || a.workload() > maxWorkload) {
                reserved.set(false);
                return a;
            }
            reserved.set(true);
            return a.withActiveTasks(a.activeTasks() + 1);
        });
        return reserved.get();
    }

    public AgentProfile decrementActive(String agentId) {
        return update(agentId, a -> a.withActiveTasks(a.activeTasks() - 1));
    }

    public AgentProfile updateHealth(String agentId, double health, double resourceHealth) {
        return update(agentId, a -> a.withHealth(clamp(health), clamp(resourceHealth)));
    }

    /**
     * Folds a closed issue into the agent's rolling performance.
     */
    public AgentProfile recordOutcome(String agentId, boolean success, double minutes, String issueType) {
        AgentProfile updated = update(agentId, a -> a.withPerformance(a.performance().record(success, minutes, issueType)));
        log.debug("Agent {} performance now {}", agentId, updated.performance());
        return updated;
    }

    public boolean remove(String agentId) {
        return agents.remove(agentId) != null;
    }

    private AgentProfile update(String agentId, UnaryOperator<AgentProfile> change) {
        AgentProfile updated = agents.computeIfPresent(agentId, (id, existing) -> change.apply(existing));
        if (updated == null) {
            throw new NotFoundException("Unknown agent: " + agentId);
        }
        return updated;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}

package com.teamflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Capability and health profile of a worker agent.
 *
 * @param id                 unique agent id
 * @param agentType          kind of agent ("coder", "tester", "reviewer"...)
 * @param capabilities       typed capability tags
 * @param workload           current workload fraction (0–1)
 * @param health             overall health score (0–1)
 * @param resourceHealth     resource-usage component of health (0–1)
 * @param performance        rolling performance metrics
 * @param maxConcurrentTasks concurrent task cap
 * @param activeTasks        number of issues currently assigned
 * @param registrationOrder  monotonically increasing registration sequence, used for tie-breaks
 * @param registeredAt       registration time
 */
public record AgentProfile(
    String id,
    String agentType,
    Set<Capability> capabilities,
    double workload,
    double health,
    double resourceHealth,
    PerformanceMetrics performance,
    int maxConcurrentTasks,
    int activeTasks,
    long registrationOrder,
    Instant registeredAt
) implements Serializable {

    public AgentProfile {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        performance = performance == null ? PerformanceMetrics.fresh() : performance;
    }

    public Set<String> capabilityNames() {
        return capabilities.stream().map(Capability::name).collect(Collectors.toUnmodifiableSet());
    }

    public boolean hasCapability(Capability capability) {
        return capabilityNames().contains(capability.name());
    }

    public boolean atCapacity() {
        return activeTasks >= maxConcurrentTasks;
    }

    public AgentProfile withActiveTasks(int count) {
        int clamped = Math.max(0, count);
        double load = maxConcurrentTasks <= 0 ? 1.0 : Math.min(1.0, (double) clamped / maxConcurrentTasks);
        return new AgentProfile(id, agentType, capabilities, load, health, resourceHealth, performance,
                maxConcurrentTasks, clamped, registrationOrder, registeredAt);
    }

    public AgentProfile withHealth(double newHealth, double newResourceHealth) {
        return new AgentProfile(id, agentType, capabilities, workload, newHealth, newResourceHealth, performance,
                maxConcurrentTasks, activeTasks, registrationOrder, registeredAt);
    }

    public AgentProfile withWorkload(double newWorkload) {
        return new AgentProfile(id, agentType, capabilities, newWorkload, health, resourceHealth, performance,
                maxConcurrentTasks, activeTasks, registrationOrder, registeredAt);
    }

    public AgentProfile withPerformance(PerformanceMetrics newPerformance) {
        return new AgentProfile(id, agentType, capabilities, workload, health, resourceHealth, newPerformance,
                maxConcurrentTasks, activeTasks, registrationOrder, registeredAt);
    }
}

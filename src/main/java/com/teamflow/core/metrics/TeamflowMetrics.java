package com.teamflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for agent coordination.
 */
@Service
public class TeamflowMetrics {

    private final MeterRegistry registry;

    public TeamflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "claimed", "already_claimed", "lock_timeout" or "no_capacity"
     */
    public void recordClaim(String outcome) {
        Counter.builder("teamflow.claims.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordScoringDuration(long nanos) {
        Timer.builder("teamflow.scoring.duration")
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    public void recordAssignmentScore(double score) {
        DistributionSummary.builder("teamflow.assignment.score")
                .description("Combined score of the winning candidate")
                .register(registry)
                .record(score);
    }

    public void recordNoCapacity() {
        Counter.builder("teamflow.balancer.no_capacity")
                .register(registry)
                .increment();
    }

    public void recordRebalanceProposals(int count) {
        Counter.builder("teamflow.balancer.rebalance_proposals")
                .register(registry)
                .increment(count);
    }

    public void recordReviewDecision(String decision) {
        Counter.builder("teamflow.review.decisions")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordConsensus(boolean accepted) {
        Counter.builder("teamflow.consensus.outcomes")
                .tag("result", accepted ? "accepted" : "rejected")
                .register(registry)
                .increment();
    }

    public void recordStallDetected(String reason) {
        Counter.builder("teamflow.stall.detected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordEscalation(int level) {
        Counter.builder("teamflow.stall.escalations")
                .tag("level", String.valueOf(level))
                .register(registry)
                .increment();
    }

    public void recordSyncFailure(String operation) {
        Counter.builder("teamflow.sync.failures")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordEpicTransition(String target) {
        Counter.builder("teamflow.epic.transitions")
                .tag("to", target)
                .register(registry)
                .increment();
    }
}

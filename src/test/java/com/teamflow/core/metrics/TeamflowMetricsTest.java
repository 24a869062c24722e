package com.teamflow.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TeamflowMetricsTest {

    private SimpleMeterRegistry registry;
    private TeamflowMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TeamflowMetrics(registry);
    }

    @Test
    @DisplayName("recordClaim counts by outcome")
    void recordClaim() {
        metrics.recordClaim("claimed");
        metrics.recordClaim("claimed");
        metrics.recordClaim("contention");

        assertEquals(2.0, registry.find("teamflow.claims.total").tag("outcome", "claimed").counter().count());
        assertEquals(1.0, registry.find("teamflow.claims.total").tag("outcome", "contention").counter().count());
    }

    @Test
    @DisplayName("recordAssignmentScore feeds a distribution summary")
    void recordAssignmentScore() {
        metrics.recordAssignmentScore(67.5);
        metrics.recordAssignmentScore(80.0);

        var summary = registry.find("teamflow.assignment.score").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(147.5, summary.totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("recordEscalation tags the ladder level")
    void recordEscalation() {
        metrics.recordEscalation(2);

        var counter = registry.find("teamflow.stall.escalations").tag("level", "2").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordConsensus separates accepted from rejected")
    void recordConsensus() {
        metrics.recordConsensus(true);
        metrics.recordConsensus(false);
        metrics.recordConsensus(false);

        assertEquals(1.0, registry.find("teamflow.consensus.outcomes").tag("result", "accepted").counter().count());
        assertEquals(2.0, registry.find("teamflow.consensus.outcomes").tag("result", "rejected").counter().count());
    }

    @Test
    @DisplayName("recordScoringDuration creates a timer")
    void recordScoringDuration() {
        metrics.recordScoringDuration(1_000_000);

        var timer = registry.find("teamflow.scoring.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }
}

package com.teamflow.core.review;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.metrics.TeamflowMetrics;
import com.teamflow.core.model.ConsensusProposal;
import com.teamflow.core.model.ConsensusResult;
import com.teamflow.core.model.DecisionClass;
import com.teamflow.core.model.Vote;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsensusEngineTest {

    private ConsensusEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ConsensusEngine(new TeamflowProperties(), new TeamflowMetrics(new SimpleMeterRegistry()));
    }

    private static ConsensusProposal proposal(DecisionClass decisionClass, String lead, Vote... votes) {
        return new ConsensusProposal("p-1", "epic-1", "Switch to event sourcing", decisionClass, lead, List.of(votes));
    }

    @Test
    @DisplayName("lead weight can carry a standard decision")
    void leadCarries() {
        ConsensusResult result = engine.decide(proposal(DecisionClass.STANDARD, "lead",
                new Vote("lead", true), new Vote("a", false), new Vote("b", false)));

        assertEquals(3.0, result.approveWeight(), 1e-9);
        assertEquals(5.0, result.totalWeight(), 1e-9);
        assertEquals(0.6, result.approveFraction(), 1e-9);
        assertTrue(result.accepted());
    }

    @Test
    @DisplayName("the same split fails the critical threshold")
    void criticalNeedsMore() {
        ConsensusResult result = engine.decide(proposal(DecisionClass.CRITICAL, "lead",
                new Vote("lead", true), new Vote("a", false), new Vote("b", false)));

        assertEquals(0.66, result.threshold(), 1e-9);
        assertFalse(result.accepted());
    }

    @Test
    @DisplayName("a later vote from the same voter replaces the earlier one")
    void lastVoteWins() {
        ConsensusResult result = engine.decide(proposal(DecisionClass.STANDARD, null,
                new Vote("a", false), new Vote("b", true), new Vote("a", true)));

        assertEquals(2.0, result.totalWeight(), 1e-9);
        assertTrue(result.accepted());
    }

    @Test
    @DisplayName("no votes means rejected")
    void noVotes() {
        assertFalse(engine.decide(proposal(DecisionClass.STANDARD, null)).accepted());
    }
}

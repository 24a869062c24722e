package com.teamflow.core.review;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.metrics.TeamflowMetrics;
import com.teamflow.core.model.ConsensusProposal;
import com.teamflow.core.model.ConsensusResult;
import com.teamflow.core.model.DecisionClass;
import com.teamflow.core.model.Vote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted vote for epic-level decisions.
 * <p>
 * Every voter weighs 1 except the lead, who weighs {@code leadWeight}. A later
 * vote from the same voter replaces the earlier one. A proposal with no votes
 * is rejected.
 */
@Service
public class ConsensusEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsensusEngine.class);

    private final TeamflowProperties.Review config;
    private final TeamflowMetrics metrics;

    public ConsensusEngine(TeamflowProperties properties, TeamflowMetrics metrics) {
        this.config = properties.getReview();
        this.metrics = metrics;
    }

    public ConsensusResult decide(ConsensusProposal proposal) {
        Map<String, Boolean> ballots = new LinkedHashMap<>();
        for (Vote vote : proposal.votes()) {
            ballots.put(vote.voterId(), vote.approve());
        }

        double approve = 0.0;
        double total = 0.0;
        for (var ballot : ballots.entrySet()) {
            double weight = ballot.getKey().equals(proposal.leadId()) ? config.getLeadWeight() : 1.0;
            total += weight;
            if (ballot.getValue()) {
                approve += weight;
            }
        }

        double threshold = thresholdFor(proposal.decisionClass());
        double fraction = total == 0 ? 0.0 : approve / total;
        boolean accepted = total > 0 && fraction >= threshold;

        metrics.recordConsensus(accepted);
        log.info("Proposal {} on epic {}: {}/{} weighted approve ({}), threshold {} -> {}",
                proposal.id(), proposal.epicId(), approve, total, String.format("%.2f", fraction), threshold,
                accepted ? "accepted" : "rejected");
        return new ConsensusResult(proposal.id(), approve, total, fraction, threshold, accepted);
    }

    public double thresholdFor(DecisionClass decisionClass) {
        return decisionClass == DecisionClass.CRITICAL ? config.getCriticalConsensus() : config.getStandardConsensus();
    }
}

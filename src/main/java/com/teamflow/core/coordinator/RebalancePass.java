package com.teamflow.core.coordinator;

import com.teamflow.core.agent.AgentRegistry;
import com.teamflow.core.balancer.FairnessBalancer;
import com.teamflow.core.balancer.RebalanceProposal;
import com.teamflow.core.error.CoordinationException;
import com.teamflow.core.metrics.TeamflowMetrics;
import com.teamflow.core.model.AgentProfile;
import com.teamflow.core.model.Issue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Periodically moves work from overloaded agents to underloaded ones.
 * Only runs when scheduling is enabled (teammate mode).
 */
@Component
public class RebalancePass {

    private static final Logger log = LoggerFactory.getLogger(RebalancePass.class);

    private final AgentRegistry agents;
    private final FairnessBalancer balancer;
    private final TaskCoordinator coordinator;
    private final TeamflowMetrics metrics;

    public RebalancePass(AgentRegistry agents, FairnessBalancer balancer, TaskCoordinator coordinator,
                         TeamflowMetrics metrics) {
        this.agents = agents;
        this.balancer = balancer;
        this.coordinator = coordinator;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${teamflow.balancer.rebalance-interval-ms:300000}")
    public void scheduledRun() {
        run();
    }

    /**
     * Runs one pass.
     *
     * @return number of issues actually moved
     */
    public int run() {
        List<AgentProfile> pool = agents.all();
        Map<String, List<Issue>> movable = new LinkedHashMap<>();
        for (AgentProfile agent : pool) {
            movable.put(agent.id(), coordinator.movableIssues(agent.id()));
        }
        List<RebalanceProposal> proposals = balancer.proposeRebalance(pool, movable);
        metrics.recordRebalanceProposals(proposals.size());

        int moved = 0;
        for (RebalanceProposal proposal : proposals) {
            try {
                if (coordinator.moveTo(proposal.issueId(), proposal.fromAgentId(), proposal.toAgentId(),
                        "rebalance").isPresent()) {
                    moved++;
                }
            } catch (CoordinationException | IllegalStateException e) {
                log.warn("Rebalance of {} from {} to {} skipped: {}", proposal.issueId(),
                        proposal.fromAgentId(), proposal.toAgentId(), e.getMessage());
            }
        }
        if (!proposals.isEmpty()) {
            log.info("Rebalance pass moved {} of {} proposed issue(s)", moved, proposals.size());
        }
        return moved;
    }
}

package com.teamflow.core.balancer;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.error.NoCapacityException;
import com.teamflow.core.model.AgentProfile;
import com.teamflow.core.model.AgentScore;
import com.teamflow.core.model.Issue;
import com.teamflow.core.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks one agent for one issue, trading raw match quality against load.
 * <p>
 * Agents at their concurrent-task cap, above the workload ceiling or below the
 * scoring threshold are never candidates. Among the rest the combined score
 * {@code matchWeight * raw + fairnessWeight * fairness} wins, where fairness
 * favours agents carrying fewer tasks than the pool average. Ties go to the
 * agent registered first.
 */
@Service
public class FairnessBalancer {

    private static final Logger log = LoggerFactory.getLogger(FairnessBalancer.class);

    private static final Comparator<Candidate> BEST_FIRST = Comparator
            .comparingDouble(Candidate::combined).reversed()
            .thenComparingLong(c -> c.agent().registrationOrder());

    private final ScoringEngine scoringEngine;
    private final TeamflowProperties.Balancer config;

    public FairnessBalancer(ScoringEngine scoringEngine, TeamflowProperties properties) {
        this.scoringEngine = scoringEngine;
        this.config = properties.getBalancer();
    }

    /**
     * Eligible candidates for the issue, best first.
     *
     * @param pool     every known agent (used for the average load)
     * @param excluded agent ids that must not be picked
     */
    public List<Candidate> candidates(Issue issue, Collection<AgentProfile> pool, Set<String> excluded) {
        double averageActive = pool.stream().mapToInt(AgentProfile::activeTasks).average().orElse(0.0);
        List<Candidate> result = new ArrayList<>();
        for (AgentProfile agent : pool) {
            if (excluded.contains(agent.id()) || !hasRoom(agent)) {
                continue;
            }
            AgentScore score = scoringEngine.score(agent, issue);
            if (!score.meetsThreshold()) {
                log.debug("Agent {} below threshold for {}: {}", agent.id(), issue.id(), score.total());
                continue;
            }
            double fairness = fairness(averageActive, agent.activeTasks());
            double combined = config.getMatchWeight() * score.total() + config.getFairnessWeight() * fairness;
            log.debug("Candidate {} for {}: raw={} fairness={} combined={}",
                    agent.id(), issue.id(), score.total(), fairness, combined);
            result.add(new Candidate(agent, score, fairness, combined));
        }
        result.sort(BEST_FIRST);
        return result;
    }

    /**
     * @throws NoCapacityException if no agent is eligible
     */
    public Candidate select(Issue issue, Collection<AgentProfile> pool, Set<String> excluded) {
        List<Candidate> ranked = candidates(issue, pool, excluded);
        if (ranked.isEmpty()) {
            throw new NoCapacityException("No eligible agent for issue " + issue.id());
        }
        return ranked.get(0);
    }

    /**
     * Proposes moving at most one task away from each overloaded agent to a
     * distinct underloaded agent that qualifies for it.
     *
     * @param pool          every known agent
     * @param movableByAgent issues each agent could hand over, most movable first
     */
    public List<RebalanceProposal> proposeRebalance(Collection<AgentProfile> pool,
                                                    Map<String, List<Issue>> movableByAgent) {
        List<AgentProfile> overloaded = pool.stream()
                .filter(a -> a.workload() > config.getMaxWorkload())
                .sorted(Comparator.comparingDouble(AgentProfile::workload).reversed()
                        .thenComparingLong(AgentProfile::registrationOrder))
                .toList();
        List<AgentProfile> underloaded = pool.stream()
                .filter(a -> a.workload() < config.getUnderloadThreshold() && !a.atCapacity())
                .sorted(Comparator.comparingDouble(AgentProfile::workload)
                        .thenComparingLong(AgentProfile::registrationOrder))
                .toList();

        List<RebalanceProposal> proposals = new ArrayList<>();
        Set<String> usedTargets = new HashSet<>();
        for (AgentProfile source : overloaded) {
            RebalanceProposal proposal = proposeFor(source, underloaded, usedTargets,
                    movableByAgent.getOrDefault(source.id(), List.of()));
            if (proposal != null) {
                usedTargets.add(proposal.toAgentId());
                proposals.add(proposal);
            }
        }
        log.debug("Rebalance pass: {} overloaded, {} underloaded, {} proposals",
                overloaded.size(), underloaded.size(), proposals.size());
        return proposals;
    }

    private RebalanceProposal proposeFor(AgentProfile source, List<AgentProfile> targets,
                                         Set<String> usedTargets, List<Issue> movable) {
        for (Issue issue : movable) {
            for (AgentProfile target : targets) {
                if (usedTargets.contains(target.id()) || target.id().equals(source.id())) {
                    continue;
                }
                AgentScore score = scoringEngine.score(target, issue);
                if (score.meetsThreshold()) {
                    return new RebalanceProposal(issue.id(), source.id(), target.id(), score.total());
                }
            }
        }
        return null;
    }

    public boolean hasRoom(AgentProfile agent) {
        return !agent.atCapacity() && agent.workload() <= config.getMaxWorkload();
    }

    static double fairness(double averageActive, int active) {
        return Math.max(0.0, Math.min(100.0, 50.0 + 10.0 * (averageActive - active)));
    }
}

package com.teamflow.core.scoring;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.model.AgentProfile;
import com.teamflow.core.model.AgentScore;
import com.teamflow.core.model.Capability;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.PerformanceMetrics;
import com.teamflow.core.model.ScoreBreakdown;
import com.teamflow.core.model.WorkRequirements;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores how well an agent fits an issue.
 * <p>
 * Five factors are computed independently as ratios in [0, 1] and scaled by
 * {@link ScoringWeights}. The result depends only on its inputs.
 */
@Service
public class ScoringEngine {

    static final double NEUTRAL_MATCH = 0.5;
    static final double PARTIAL_CREDIT = 0.8;
    static final double HIGH_PERFORMER = 0.9;

    private final ScoringWeights weights;
    private final double minimumScore;

    @Autowired
    public ScoringEngine(TeamflowProperties properties) {
        this(ScoringWeights.from(properties.getScoring()), properties.getScoring().getMinimumScore());
    }

    public ScoringEngine(ScoringWeights weights, double minimumScore) {
        this.weights = weights;
        this.minimumScore = minimumScore;
    }

    public double minimumScore() {
        return minimumScore;
    }

    public AgentScore score(AgentProfile agent, Issue issue) {
        WorkRequirements req = issue.requirements();
        Set<String> agentCaps = agent.capabilityNames();

        double capabilityRatio = capabilityMatch(agentCaps, req);
        var breakdown = new ScoreBreakdown(
                capabilityRatio * weights.capabilityMatch(),
                clamp01(agent.performance().successRate()) * weights.performance(),
                availability(agent) * weights.availability(),
                specialization(agent, agentCaps, req) * weights.specialization(),
                experience(agent.performance(), req) * weights.experience());

        double total = Math.max(0.0, Math.min(100.0, breakdown.total()));
        double confidence = confidence(agent, agentCaps, req, capabilityRatio);
        return new AgentScore(agent.id(), issue.id(), total, breakdown, confidence, total >= minimumScore);
    }

    /**
     * Scores every agent and orders them best first. Equal totals keep registration order.
     */
    public List<AgentScore> rank(Collection<AgentProfile> agents, Issue issue) {
        var order = agents.stream().sorted(Comparator.comparingLong(AgentProfile::registrationOrder)).toList();
        return order.stream()
                .map(a -> score(a, issue))
                .sorted(Comparator.comparingDouble(AgentScore::total).reversed())
                .toList();
    }

    static double capabilityMatch(Set<String> agentCaps, WorkRequirements req) {
        int count = req.requirementCount();
        if (count == 0) {
            return NEUTRAL_MATCH;
        }
        double hits = countHits(agentCaps, req.requiredCapabilities());
        hits += PARTIAL_CREDIT * countHits(agentCaps, req.languages());
        hits += PARTIAL_CREDIT * countHits(agentCaps, req.frameworks());
        return clamp01(hits / count);
    }

    static double availability(AgentProfile agent) {
        return clamp01(((1.0 - clamp01(agent.workload())) + clamp01(agent.health())) / 2.0);
    }

    static double specialization(AgentProfile agent, Set<String> agentCaps, WorkRequirements req) {
        double typePart;
        if (req.issueType() == null || req.issueType().isBlank()) {
            typePart = 0.25;
        } else {
            typePart = req.issueType().equalsIgnoreCase(agent.agentType()) ? 0.5 : 0.0;
        }

        Set<Capability> domains = new HashSet<>(req.domains());
        domains.addAll(req.preferredCapabilities());
        double domainPart = domains.isEmpty() ? 0.25 : 0.5 * countHits(agentCaps, domains) / domains.size();
        return clamp01(typePart + domainPart);
    }

    static double experience(PerformanceMetrics perf, WorkRequirements req) {
        int done = perf.tasksCompleted();
        double countBand;
        if (done >= 50) countBand = 0.5;
        else if (done >= 20) countBand = 0.4;
        else if (done >= 10) countBand = 0.3;
        else if (done >= 1) countBand = 0.2;
        else countBand = 0.1;

        double rate = perf.successRate();
        double rateBand;
        if (rate >= 0.9) rateBand = 0.3;
        else if (rate >= 0.75) rateBand = 0.2;
        else if (rate >= 0.5) rateBand = 0.1;
        else rateBand = 0.0;

        double speedBonus = 0.0;
        if (req.estimatedMinutes() != null && done > 0) {
            double avg = perf.averageMinutesFor(req.issueType());
            if (avg > 0 && avg < req.estimatedMinutes()) {
                speedBonus = 0.2;
            }
        }
        return Math.min(1.0, countBand + rateBand + speedBonus);
    }

    static double confidence(AgentProfile agent, Set<String> agentCaps, WorkRequirements req, double capabilityRatio) {
        double confidence = capabilityRatio;
        int required = req.requiredCapabilities().size();
        if (required > 0) {
            int missing = required - countHits(agentCaps, req.requiredCapabilities());
            confidence *= 1.0 - 0.5 * missing / required;
        }
        if (agent.performance().successRate() >= HIGH_PERFORMER && agent.health() >= HIGH_PERFORMER) {
            confidence *= 1.1;
        }
        return clamp01(confidence);
    }

    private static int countHits(Set<String> agentCaps, Set<Capability> wanted) {
        int hits = 0;
        for (Capability c : wanted) {
            if (agentCaps.contains(c.name())) {
                hits++;
            }
        }
        return hits;
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}

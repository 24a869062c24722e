package com.teamflow.core.review;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.error.ReviewerUnavailableException;
import com.teamflow.core.model.AgentProfile;
import com.teamflow.core.model.Capability;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.WorkRequirements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Chooses a reviewer for an issue.
 * <p>
 * Reviewer score is {@code 60 * overlap + 20 * successRate + 20 * (1 - workload)},
 * multiplied by the recent-pair penalty when reviewer and author reviewed each
 * other inside the window. Agents whose capability overlap reaches the preferred
 * level rank ahead of the rest. The epic's own agents are tried first; the whole
 * pool only if none of them reaches the minimum score.
 */
public class ReviewerSelector {

    private static final Logger log = LoggerFactory.getLogger(ReviewerSelector.class);

    private final TeamflowProperties.Review config;
    private final RecentReviewPairs recentPairs;

    public ReviewerSelector(TeamflowProperties.Review config, RecentReviewPairs recentPairs) {
        this.config = config;
        this.recentPairs = recentPairs;
    }

    /**
     * @throws ReviewerUnavailableException if no agent other than the author qualifies in either pool
     */
    public ReviewerChoice select(Issue issue, String authorId, Collection<AgentProfile> epicPool,
                                 Collection<AgentProfile> allAgents, Instant now) {
        Optional<ReviewerChoice> choice = best(issue, authorId, epicPool, true, now);
        if (choice.isEmpty()) {
            log.debug("No in-epic reviewer for {}, widening to all agents", issue.id());
            choice = best(issue, authorId, allAgents, false, now);
        }
        return choice.orElseThrow(() -> new ReviewerUnavailableException(
                "No reviewer scoring at least " + config.getReviewerMinScore() + " for issue " + issue.id()));
    }

    private Optional<ReviewerChoice> best(Issue issue, String authorId, Collection<AgentProfile> pool,
                                          boolean fromEpicPool, Instant now) {
        Set<String> wanted = capabilityNames(issue.requirements());
        return pool.stream()
                .filter(a -> !a.id().equals(authorId))
                .map(a -> score(a, authorId, wanted, fromEpicPool, now))
                .filter(c -> c.score() >= config.getReviewerMinScore())
                .min(Comparator
                        .comparing((ReviewerChoice c) -> c.overlap() < config.getCapabilityOverlap())
                        .thenComparing(Comparator.comparingDouble(ReviewerChoice::score).reversed())
                        .thenComparingLong(c -> c.reviewer().registrationOrder()));
    }

    ReviewerChoice score(AgentProfile agent, String authorId, Set<String> wanted, boolean fromEpicPool, Instant now) {
        double overlap = overlap(agent, wanted);
        double score = 60 * overlap
                + 20 * agent.performance().successRate()
                + 20 * (1.0 - agent.workload());
        if (recentPairs.recentlyPaired(agent.id(), authorId, now)) {
            score *= config.getRecentPairPenalty();
        }
        return new ReviewerChoice(agent, score, overlap, fromEpicPool);
    }

    static double overlap(AgentProfile agent, Set<String> wanted) {
        if (wanted.isEmpty()) {
            return 1.0;
        }
        Set<String> common = new HashSet<>(wanted);
        common.retainAll(agent.capabilityNames());
        return (double) common.size() / wanted.size();
    }

    static Set<String> capabilityNames(WorkRequirements req) {
        Set<String> names = new HashSet<>();
        for (Set<Capability> group : List.of(req.requiredCapabilities(), req.languages(),
                req.frameworks(), req.domains())) {
            group.forEach(c -> names.add(c.name()));
        }
        return names;
    }
}

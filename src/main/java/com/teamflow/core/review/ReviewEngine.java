package com.teamflow.core.review;

import com.teamflow.core.agent.AgentRegistry;
import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.coordinator.AssignmentLedger;
import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.error.NotFoundException;
import com.teamflow.core.error.ReviewerUnavailableException;
import com.teamflow.core.events.EventBus;
import com.teamflow.core.events.EventTypes;
import com.teamflow.core.events.TeamflowEvent;
import com.teamflow.core.logging.MdcContext;
import com.teamflow.core.metrics.TeamflowMetrics;
import com.teamflow.core.model.AgentProfile;
import com.teamflow.core.model.Assignment;
import com.teamflow.core.model.AutomatedCheck;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.IssueStatus;
import com.teamflow.core.model.ManualReview;
import com.teamflow.core.model.ReviewDecision;
import com.teamflow.core.model.ReviewRecord;
import com.teamflow.core.persistence.CoordinationRepository;
import com.teamflow.core.sync.TrackerSync;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Peer review of completed issues.
 * <p>
 * A review runs in two steps. {@link #begin} ingests automated check results:
 * a blocking failure decides CHANGES_REQUESTED on the spot without using a
 * reviewer, otherwise a reviewer is selected and the review waits. {@link #submit}
 * takes the reviewer's sub-scores and decides:
 * <ul>
 *   <li>APPROVED when the composite reaches the approval threshold and every acceptance criterion is met</li>
 *   <li>inconclusive when the composite passes but a non-blocking check failed; retried once, then ESCALATED</li>
 *   <li>CHANGES_REQUESTED otherwise</li>
 * </ul>
 * Records are immutable; a re-review appends a new one.
 */
@Service
public class ReviewEngine {

    private static final Logger log = LoggerFactory.getLogger(ReviewEngine.class);

    private final ConcurrentHashMap<String, PendingReview> pending = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<ReviewRecord>> records = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> epicOfIssue = new ConcurrentHashMap<>();

    private final TeamflowProperties.Review config;
    private final ReviewerSelector selector;
    private final RecentReviewPairs recentPairs;
    private final AgentRegistry agents;
    private final AssignmentLedger ledger;
    private final IssueBoard board;
    private final CoordinationRepository repository;
    private final TrackerSync trackerSync;
    private final EventBus eventBus;
    private final TeamflowMetrics metrics;
    private final Clock clock;

    public ReviewEngine(TeamflowProperties properties, AgentRegistry agents, AssignmentLedger ledger,
                        IssueBoard board, CoordinationRepository repository, TrackerSync trackerSync,
                        EventBus eventBus, TeamflowMetrics metrics, Clock clock) {
        this.config = properties.getReview();
        this.recentPairs = new RecentReviewPairs(config.getRecentPairWindow());
        this.selector = new ReviewerSelector(config, recentPairs);
        this.agents = agents;
        this.ledger = ledger;
        this.board = board;
        this.repository = repository;
        this.trackerSync = trackerSync;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Starts the review of an issue the author just completed.
     *
     * @return the decision when one was reached immediately, or empty while a reviewer is pending
     */
    public Optional<ReviewRecord> begin(Issue issue, String authorId, List<AutomatedCheck> checks) {
        Instant now = clock.instant();
        MdcContext.setClaim(issue.epicId(), issue.id(), authorId);
        try {
            epicOfIssue.put(issue.id(), issue.epicId());
            List<AutomatedCheck> blocking = checks.stream().filter(AutomatedCheck::isBlockingFailure).toList();
            if (!blocking.isEmpty()) {
                String reason = "Blocking check failed: " + blocking.stream()
                        .map(c -> c.type().name() + (c.detail() == null ? "" : " (" + c.detail() + ")"))
                        .collect(Collectors.joining(", "));
                return Optional.of(decide(issue, authorId, null, checks, null, ReviewDecision.CHANGES_REQUESTED,
                        reason, 0, now));
            }

            ReviewerChoice choice;
            try {
                choice = selector.select(issue, authorId, epicPool(issue.epicId()), agents.all(), now);
            } catch (ReviewerUnavailableException e) {
                log.warn("{}; escalating review of {} to a human", e.getMessage(), issue.id());
                trackerSync.escalateToHuman(issue.number(), "No qualified reviewer available for this issue.");
                return Optional.of(decide(issue, authorId, null, checks, null, ReviewDecision.ESCALATED,
                        e.getMessage(), 0, now));
            }

            var review = new PendingReview(issue.id(), issue.epicId(), authorId, choice.reviewer().id(),
                    checks, 0, now);
            pending.put(issue.id(), review);
            log.info("Review of {} assigned to {} (score {}, overlap {})", issue.id(), choice.reviewer().id(),
                    String.format("%.1f", choice.score()), String.format("%.2f", choice.overlap()));
            return Optional.empty();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Applies the reviewer's scores.
     *
     * @return the decision, or empty when the review was inconclusive and goes round once more,
     *         or when the issue left review in the meantime (the outcome is discarded)
     * @throws NotFoundException        if no review is pending for the issue
     * @throws IllegalArgumentException if {@code reviewerId} is not the selected reviewer
     */
    public Optional<ReviewRecord> submit(String issueId, String reviewerId, ManualReview manual) {
        PendingReview review = pending.get(issueId);
        if (review == null) {
            throw new NotFoundException("No pending review for issue " + issueId);
        }
        if (!review.reviewerId().equals(reviewerId)) {
            throw new IllegalArgumentException("Agent " + reviewerId + " is not the reviewer of " + issueId);
        }
        Issue issue = board.get(issueId);
        if (issue.status() != IssueStatus.IN_REVIEW) {
            pending.remove(issueId);
            log.warn("Discarding review of {}: issue is now {}", issueId, issue.status());
            return Optional.empty();
        }

        Instant now = clock.instant();
        MdcContext.setClaim(issue.epicId(), issueId, reviewerId);
        try {
            double composite = manual.composite();
            boolean passesQuality = composite >= config.getApprovalThreshold();
            List<AutomatedCheck> advisoryFailures = review.checks().stream()
                    .filter(c -> !c.passed() && !c.blocking())
                    .toList();

            if (passesQuality && !advisoryFailures.isEmpty()) {
                PendingReview retried = review.retried();
                if (retried.attempts() < config.getMaxAttempts()) {
                    pending.put(issueId, retried);
                    log.info("Review of {} inconclusive (composite {} but {} check(s) failed); requesting another pass",
                            issueId, String.format("%.2f", composite), advisoryFailures.size());
                    eventBus.publish(TeamflowEvent.of(EventTypes.REVIEW_RETRY_REQUESTED, issue.epicId(), issueId,
                            Map.of("reviewerId", reviewerId, "attempt", retried.attempts())));
                    return Optional.empty();
                }
                trackerSync.escalateToHuman(issue.number(),
                        "Review could not reach a decision: manual review passed but automated checks failed.");
                return Optional.of(decide(issue, review.authorId(), reviewerId, review.checks(), manual,
                        ReviewDecision.ESCALATED, "Conflicting manual and automated signals after retry",
                        retried.attempts(), now));
            }

            ReviewDecision decision;
            String reason;
            if (passesQuality && manual.unmetCriteria().isEmpty()) {
                decision = ReviewDecision.APPROVED;
                reason = "Composite " + String.format("%.2f", composite) + " meets threshold " + config.getApprovalThreshold();
            } else if (!passesQuality) {
                decision = ReviewDecision.CHANGES_REQUESTED;
                reason = "Composite " + String.format("%.2f", composite) + " below threshold " + config.getApprovalThreshold();
            } else {
                decision = ReviewDecision.CHANGES_REQUESTED;
                reason = "Unmet acceptance criteria: " + String.join(", ", manual.unmetCriteria());
            }
            return Optional.of(decide(issue, review.authorId(), reviewerId, review.checks(), manual, decision,
                    reason, review.attempts() + 1, now));
        } finally {
            MdcContext.clear();
        }
    }

    public Optional<PendingReview> pending(String issueId) {
        return Optional.ofNullable(pending.get(issueId));
    }

    /** Drops a pending review whose issue closed externally. */
    public boolean abandon(String issueId) {
        boolean removed = pending.remove(issueId) != null;
        if (removed) {
            log.info("Abandoned pending review of {}", issueId);
        }
        return removed;
    }

    public List<ReviewRecord> history(String issueId) {
        return List.copyOf(records.getOrDefault(issueId, new CopyOnWriteArrayList<>()));
    }

    public List<ReviewRecord> forEpic(String epicId) {
        return records.entrySet().stream()
                .filter(e -> epicId.equals(epicOfIssue.get(e.getKey())))
                .flatMap(e -> e.getValue().stream())
                .sorted(Comparator.comparing(ReviewRecord::decidedAt))
                .toList();
    }

    public void restore(String epicId, Collection<ReviewRecord> restored) {
        for (ReviewRecord record : restored) {
            epicOfIssue.put(record.issueId(), epicId);
            var list = records.computeIfAbsent(record.issueId(), k -> new CopyOnWriteArrayList<>());
            list.addIfAbsent(record);
            if (record.reviewerId() != null) {
                recentPairs.record(record.reviewerId(), record.authorId(), record.decidedAt());
            }
        }
    }

    public void removeEpic(String epicId) {
        var issues = epicOfIssue.entrySet().stream()
                .filter(e -> e.getValue().equals(epicId))
                .map(Map.Entry::getKey)
                .toList();
        issues.forEach(id -> {
            records.remove(id);
            pending.remove(id);
            epicOfIssue.remove(id);
        });
    }

    private ReviewRecord decide(Issue issue, String authorId, String reviewerId, List<AutomatedCheck> checks,
                                ManualReview manual, ReviewDecision decision, String reason, int attempts,
                                Instant now) {
        PendingReview review = pending.remove(issue.id());
        Instant startedAt = review != null ? review.startedAt() : now;
        var record = new ReviewRecord(UUID.randomUUID().toString(), issue.id(), reviewerId, authorId, checks,
                manual, decision, reason, attempts, startedAt, now);
        records.computeIfAbsent(issue.id(), k -> new CopyOnWriteArrayList<>()).add(record);
        repository.saveReview(issue.epicId(), record);
        if (reviewerId != null) {
            recentPairs.record(reviewerId, authorId, now);
        }
        metrics.recordReviewDecision(decision.name().toLowerCase(Locale.ROOT));
        log.info("Review of {} decided {}: {}", issue.id(), decision, reason);
        eventBus.publish(TeamflowEvent.of(EventTypes.REVIEW_DECIDED, issue.epicId(), issue.id(),
                Map.of("decision", decision.name(), "reason", reason)));
        return record;
    }

    private List<AgentProfile> epicPool(String epicId) {
        Set<String> ids = ledger.forEpic(epicId).stream().map(Assignment::agentId).collect(Collectors.toSet());
        return agents.all().stream().filter(a -> ids.contains(a.id())).toList();
    }
}

package com.teamflow.core.coordinator;

import com.teamflow.core.agent.AgentErrorHistory;
import com.teamflow.core.agent.AgentRegistry;
import com.teamflow.core.balancer.Candidate;
import com.teamflow.core.balancer.FairnessBalancer;
import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.epic.EpicStateMachine;
import com.teamflow.core.error.AlreadyClaimedException;
import com.teamflow.core.error.CoordinationException;
import com.teamflow.core.error.LockTimeoutException;
import com.teamflow.core.error.NoCapacityException;
import com.teamflow.core.events.EventBus;
import com.teamflow.core.events.EventTypes;
import com.teamflow.core.events.TeamflowEvent;
import com.teamflow.core.logging.MdcContext;
import com.teamflow.core.metrics.TeamflowMetrics;
import com.teamflow.core.model.AgentProfile;
import com.teamflow.core.model.AgentScore;
import com.teamflow.core.model.Assignment;
import com.teamflow.core.model.AssignmentOutcome;
import com.teamflow.core.model.AutomatedCheck;
import com.teamflow.core.model.BlockedTaskRecord;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.IssueStatus;
import com.teamflow.core.model.ManualReview;
import com.teamflow.core.model.ReviewRecord;
import com.teamflow.core.review.ReviewEngine;
import com.teamflow.core.scoring.ScoringEngine;
import com.teamflow.core.stall.BlockedTaskRegistry;
import com.teamflow.core.sync.TrackerSync;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives issues through their lifecycle: claim, progress, completion and review hand-off.
 * <p>
 * Claims are negotiated under the per-issue lock from {@link IssueLockManager}.
 * Status is checked once before taking the lock, to fail fast, and again under
 * it before anything is written, so at most one of several concurrent claimers
 * wins. The agent's task slot is reserved atomically in {@link AgentRegistry},
 * so an agent claiming several issues at once never goes past its cap. Tracker
 * mirroring happens after the lock is released. Every path that commits a result
 * first checks that the issue has not been closed in the meantime.
 */
@Service
public class TaskCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TaskCoordinator.class);

    private final IssueBoard board;
    private final AssignmentLedger ledger;
    private final IssueLockManager locks;
    private final AgentRegistry agents;
    private final AgentErrorHistory errorHistory;
    private final ScoringEngine scoringEngine;
    private final FairnessBalancer balancer;
    private final EpicStateMachine epics;
    private final ReviewEngine reviewEngine;
    private final TrackerSync trackerSync;
    private final BlockedTaskRegistry blocked;
    private final EventBus eventBus;
    private final TeamflowMetrics metrics;
    private final Clock clock;
    private final int maxClaimAttempts;
    private final double maxWorkload;

    public TaskCoordinator(IssueBoard board, AssignmentLedger ledger, IssueLockManager locks, AgentRegistry agents,
                           AgentErrorHistory errorHistory, ScoringEngine scoringEngine, FairnessBalancer balancer,
                           EpicStateMachine epics, ReviewEngine reviewEngine, TrackerSync trackerSync,
                           BlockedTaskRegistry blocked, EventBus eventBus, TeamflowMetrics metrics, Clock clock,
                           TeamflowProperties properties) {
        this.board = board;
        this.ledger = ledger;
        this.locks = locks;
        this.agents = agents;
        this.errorHistory = errorHistory;
        this.scoringEngine = scoringEngine;
        this.balancer = balancer;
        this.epics = epics;
        this.reviewEngine = reviewEngine;
        this.trackerSync = trackerSync;
        this.blocked = blocked;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.maxClaimAttempts = properties.getCoordinator().getMaxClaimAttempts();
        this.maxWorkload = properties.getBalancer().getMaxWorkload();
    }

    // -- claims --

    /**
     * Claims an open issue for an agent.
     *
     * @throws AlreadyClaimedException if the issue is no longer open
     * @throws LockTimeoutException    if the issue lock could not be taken in time
     * @throws NoCapacityException     if the agent is at its cap or over the workload ceiling
     * @throws IllegalStateException   if the epic does not accept assignments or dependencies are not done
     */
    public Assignment claimIssue(String agentId, String issueId) {
        Issue snapshot = board.get(issueId);
        MdcContext.setClaim(snapshot.epicId(), issueId, agentId);
        try {
            if (snapshot.status() != IssueStatus.OPEN) {
                metrics.recordClaim("already_claimed");
                throw new AlreadyClaimedException("Issue " + issueId + " is " + snapshot.status()
                        + (snapshot.assigneeId() != null ? " (assignee " + snapshot.assigneeId() + ")" : ""));
            }
            AgentProfile agent = agents.get(agentId);
            AgentScore score = scoringEngine.score(agent, snapshot);

            Claim claim;
            try (var lock = locks.acquire(issueId)) {
                Issue live = board.get(issueId);
                if (live.status() != IssueStatus.OPEN) {
                    metrics.recordClaim("already_claimed");
                    throw new AlreadyClaimedException("Issue " + issueId + " was claimed by " + live.assigneeId());
                }
                claim = commitClaim(live, agentId, score);
            } catch (LockTimeoutException e) {
                metrics.recordClaim("lock_timeout");
                throw e;
            }
            trackerSync.mirrorClaim(claim.issue(), agentId);
            return claim.assignment();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Picks the best agent for a ready issue and claims it for them, retrying
     * with a fresh candidate list on lock timeouts and on agents that filled up in the meantime.
     *
     * @throws NoCapacityException     if no agent qualifies
     * @throws AlreadyClaimedException if the issue got claimed by someone else
     */
    public Assignment assignNext(String issueId) {
        Set<String> excluded = new HashSet<>();
        CoordinationException last = null;
        for (int attempt = 1; attempt <= maxClaimAttempts; attempt++) {
            Issue issue = board.get(issueId);
            Candidate candidate;
            try {
                candidate = balancer.select(issue, agents.all(), excluded);
            } catch (NoCapacityException e) {
                signalNoCapacity(issue);
                throw e;
            }
            try {
                Assignment assignment = claimIssue(candidate.agentId(), issueId);
                metrics.recordAssignmentScore(candidate.combined());
                return assignment;
            } catch (LockTimeoutException e) {
                log.warn("Lock timeout assigning {} (attempt {}/{})", issueId, attempt, maxClaimAttempts);
                last = e;
            } catch (NoCapacityException e) {
                excluded.add(candidate.agentId());
                last = e;
            }
        }
        throw last;
    }

    /**
     * Assigns every ready issue of an epic, one at a time.
     */
    public List<AutoAssignResult> autoAssign(String epicId) {
        List<AutoAssignResult> results = new ArrayList<>();
        for (Issue issue : board.ready(epicId)) {
            try {
                Assignment a = assignNext(issue.id());
                results.add(new AutoAssignResult(issue.id(), AutoAssignResult.Outcome.ASSIGNED, a.agentId(), null));
            } catch (NoCapacityException e) {
                results.add(new AutoAssignResult(issue.id(), AutoAssignResult.Outcome.NO_CAPACITY, null, e.getMessage()));
            } catch (AlreadyClaimedException | LockTimeoutException e) {
                results.add(new AutoAssignResult(issue.id(), AutoAssignResult.Outcome.CONTENTION, null, e.getMessage()));
            }
        }
        log.info("Auto-assign for epic {}: {} of {} ready issue(s) assigned", epicId,
                results.stream().filter(r -> r.outcome() == AutoAssignResult.Outcome.ASSIGNED).count(), results.size());
        return results;
    }

    /**
     * Takes an in-flight issue away from its agent and gives it to the best other agent.
     *
     * @param excluded agents that must not receive the issue (the current assignee is always excluded)
     * @return the new assignment, or empty when the issue finished or closed in the meantime
     * @throws NoCapacityException if no other agent qualifies; nothing is changed in that case
     */
    public Optional<Assignment> reassign(String issueId, Set<String> excluded, String reason) {
        Issue snapshot = board.get(issueId);
        if (snapshot.status().isTerminal() || snapshot.assigneeId() == null) {
            return Optional.empty();
        }
        Set<String> exclude = new HashSet<>(excluded);
        exclude.add(snapshot.assigneeId());
        Candidate candidate;
        try {
            candidate = balancer.select(snapshot, agents.all(), exclude);
        } catch (NoCapacityException e) {
            signalNoCapacity(snapshot);
            throw e;
        }
        return moveTo(issueId, snapshot.assigneeId(), candidate.agentId(), reason);
    }

    /**
     * Moves an issue from one agent to another if it is still held by {@code fromAgentId}.
     *
     * @return the new assignment, or empty when the issue moved on
     */
    public Optional<Assignment> moveTo(String issueId, String fromAgentId, String toAgentId, String reason) {
        Claim claim;
        try (var lock = locks.acquire(issueId)) {
            Issue live = board.get(issueId);
            if (live.status().isTerminal() || !fromAgentId.equals(live.assigneeId())) {
                log.debug("Not moving {}: now {} with {}", issueId, live.status(), live.assigneeId());
                return Optional.empty();
            }
            if (!epics.acceptsAssignments(live.epicId())) {
                throw new IllegalStateException("Epic " + live.epicId() + " does not accept assignments");
            }
            AgentProfile target = agents.get(toAgentId);
            if (!agents.tryReserve(toAgentId, maxWorkload)) {
                return Optional.empty();
            }
            try {
                Instant now = clock.instant();
                reviewEngine.abandon(issueId);
                ledger.close(issueId, AssignmentOutcome.REASSIGNED, now);
                agents.find(fromAgentId).ifPresent(a -> agents.decrementActive(fromAgentId));
                Issue released = board.update(issueId, Issue::released);
                log.info("Reassigning {} from {} to {}: {}", issueId, fromAgentId, toAgentId, reason);
                claim = commitReserved(released, toAgentId, scoringEngine.score(target, released));
            } catch (RuntimeException e) {
                agents.decrementActive(toAgentId);
                throw e;
            }
        }
        trackerSync.mirrorClaim(claim.issue(), toAgentId);
        return Optional.of(claim.assignment());
    }

    /** Issues an agent could hand over during a rebalance, most recently claimed first. */
    public List<Issue> movableIssues(String agentId) {
        return board.assignedTo(agentId).stream()
                .filter(i -> i.status() == IssueStatus.CLAIMED || i.status() == IssueStatus.IN_PROGRESS)
                .sorted((a, b) -> b.claimedAt().compareTo(a.claimedAt()))
                .toList();
    }

    // -- progress and completion --

    public Issue reportProgress(String issueId, String agentId, String note) {
        Issue issue = requireAssignee(issueId, agentId);
        errorHistory.recordSuccess(agentId);
        Instant now = clock.instant();
        Issue updated = board.update(issueId, i -> {
            Issue touched = i.withActivity(now);
            return i.status() == IssueStatus.CHANGES_REQUESTED || i.status() == IssueStatus.CLAIMED
                    ? touched.withStatus(IssueStatus.IN_PROGRESS) : touched;
        });
        eventBus.publish(TeamflowEvent.of(EventTypes.ISSUE_PROGRESS, issue.epicId(), issueId,
                Map.of("agentId", agentId, "note", note == null ? "" : note)));
        return updated;
    }

    /** Records a failed step. Does not count as activity. */
    public void reportFailure(String issueId, String agentId, String error) {
        Issue issue = requireAssignee(issueId, agentId);
        errorHistory.recordFailure(agentId);
        log.info("Agent {} reported failure on {}: {}", agentId, issueId, error);
        eventBus.publish(TeamflowEvent.of(EventTypes.ISSUE_PROGRESS, issue.epicId(), issueId,
                Map.of("agentId", agentId, "failed", true, "error", error == null ? "" : error)));
    }

    /**
     * Marks the work done by its assignee and hands it to peer review.
     *
     * @return the review decision when reached immediately, empty while a reviewer is pending
     */
    public Optional<ReviewRecord> reportCompletion(String issueId, String agentId, List<AutomatedCheck> checks) {
        Issue issue = requireAssignee(issueId, agentId);
        if (issue.status() != IssueStatus.IN_PROGRESS) {
            throw new IllegalStateException("Issue " + issueId + " is " + issue.status() + ", not IN_PROGRESS");
        }
        MdcContext.setClaim(issue.epicId(), issueId, agentId);
        try {
            errorHistory.recordSuccess(agentId);
            Instant now = clock.instant();
            Issue inReview = board.update(issueId, i -> i.withStatus(IssueStatus.IN_REVIEW).withActivity(now));
            trackerSync.mirrorStatus(inReview, IssueStatus.IN_PROGRESS, IssueStatus.IN_REVIEW);
            eventBus.publish(TeamflowEvent.of(EventTypes.ISSUE_COMPLETED, issue.epicId(), issueId,
                    Map.of("agentId", agentId)));
            log.info("Agent {} completed {}; starting review", agentId, issueId);
            return reviewEngine.begin(inReview, agentId, checks == null ? List.of() : checks)
                    .flatMap(this::applyDecision);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Passes the reviewer's scores to the review engine and applies the decision.
     */
    public Optional<ReviewRecord> submitReview(String issueId, String reviewerId, ManualReview manual) {
        return reviewEngine.submit(issueId, reviewerId, manual).flatMap(this::applyDecision);
    }

    /**
     * The issue was closed on the tracker: cancel its assignment and drop any pending review.
     * A DONE issue stays DONE.
     */
    public void closeExternally(String issueId) {
        try (var lock = locks.acquire(issueId)) {
            Issue issue = board.get(issueId);
            if (issue.status().isTerminal()) {
                return;
            }
            Instant now = clock.instant();
            reviewEngine.abandon(issueId);
            ledger.close(issueId, AssignmentOutcome.CANCELLED, now);
            if (issue.assigneeId() != null) {
                agents.find(issue.assigneeId()).ifPresent(a -> agents.decrementActive(a.id()));
            }
            board.update(issueId, i -> i.withStatus(IssueStatus.CLOSED));
            log.info("Issue {} closed externally; in-flight work discarded", issueId);
        }
    }

    private Optional<ReviewRecord> applyDecision(ReviewRecord record) {
        Issue issue = board.get(record.issueId());
        if (issue.status().isTerminal()) {
            log.warn("Discarding {} decision for {}: issue is {}", record.decision(), issue.id(), issue.status());
            return Optional.of(record);
        }
        Instant now = clock.instant();
        switch (record.decision()) {
            case APPROVED -> finish(issue, now);
            case CHANGES_REQUESTED -> {
                Issue updated = board.update(issue.id(), i -> i.withStatus(IssueStatus.CHANGES_REQUESTED).withActivity(now));
                trackerSync.mirrorStatus(updated, IssueStatus.IN_REVIEW, IssueStatus.CHANGES_REQUESTED);
            }
            case ESCALATED -> {
                blocked.save(BlockedTaskRecord.reviewEscalated(issue, record.reason(), now));
                log.warn("Review of {} escalated to a human: {}", issue.id(), record.reason());
            }
        }
        return Optional.of(record);
    }

    private void finish(Issue issue, Instant now) {
        board.update(issue.id(), i -> i.withStatus(IssueStatus.APPROVED));
        Issue done = board.update(issue.id(), i -> i.completed(now));
        ledger.close(issue.id(), AssignmentOutcome.COMPLETED, now);
        if (issue.assigneeId() != null && agents.find(issue.assigneeId()).isPresent()) {
            agents.decrementActive(issue.assigneeId());
            double minutes = issue.claimedAt() == null ? 0.0
                    : Duration.between(issue.claimedAt(), now).toSeconds() / 60.0;
            agents.recordOutcome(issue.assigneeId(), true, minutes, issue.requirements().issueType());
        }
        trackerSync.mirrorStatus(done, IssueStatus.IN_REVIEW, IssueStatus.DONE);
        log.info("Issue {} approved and done", issue.id());

        for (Issue dependent : board.dependents(issue.id())) {
            if (dependent.status() == IssueStatus.OPEN && board.dependenciesMet(dependent)) {
                eventBus.publish(TeamflowEvent.of(EventTypes.ISSUE_UNBLOCKED, dependent.epicId(), dependent.id(),
                        Map.of("unblockedBy", issue.id())));
            }
        }
        requestEpicReviewIfFinished(issue.epicId());
    }

    private void requestEpicReviewIfFinished(String epicId) {
        List<Issue> issues = board.byEpic(epicId);
        boolean allFinished = !issues.isEmpty()
                && issues.stream().allMatch(i -> i.status().isTerminal())
                && issues.stream().anyMatch(i -> i.status() == IssueStatus.DONE);
        if (allFinished) {
            epics.transitionIf(epicId, EpicState.ACTIVE, EpicState.REVIEW, "all issues done")
                    .ifPresent(e -> log.info("Epic {} moved to review: all issues done", epicId));
        }
    }

    private record Claim(Assignment assignment, Issue issue) {
    }

    /** Must be called with the issue lock held. */
    private Claim commitClaim(Issue live, String agentId, AgentScore score) {
        if (!epics.acceptsAssignments(live.epicId())) {
            throw new IllegalStateException("Epic " + live.epicId() + " is " + epics.get(live.epicId()).state()
                    + " and does not accept assignments");
        }
        if (!board.dependenciesMet(live)) {
            throw new IllegalStateException("Issue " + live.id() + " has unfinished dependencies " + live.dependencies());
        }
        if (!agents.tryReserve(agentId, maxWorkload)) {
            AgentProfile agent = agents.get(agentId);
            metrics.recordClaim("no_capacity");
            throw new NoCapacityException("Agent " + agentId + " has no room (" + agent.activeTasks() + "/"
                    + agent.maxConcurrentTasks() + ", workload " + agent.workload() + ")");
        }
        try {
            return commitReserved(live, agentId, score);
        } catch (RuntimeException e) {
            agents.decrementActive(agentId);
            throw e;
        }
    }

    /** Must be called with the issue lock held and a slot already reserved for {@code agentId}. */
    private Claim commitReserved(Issue live, String agentId, AgentScore score) {
        Instant now = clock.instant();
        Assignment assignment = ledger.open(live, agentId, score, now);
        board.update(live.id(), i -> i.claimedBy(agentId, now));
        Issue started = board.update(live.id(), i -> i.withStatus(IssueStatus.IN_PROGRESS));

        metrics.recordClaim("claimed");
        log.info("Agent {} claimed {} (score {})", agentId, live.id(), String.format("%.1f", score.total()));
        eventBus.publish(TeamflowEvent.of(EventTypes.ISSUE_CLAIMED, live.epicId(), live.id(),
                Map.of("agentId", agentId, "score", score.total(), "assignmentId", assignment.id())));
        return new Claim(assignment, started);
    }

    private Issue requireAssignee(String issueId, String agentId) {
        Issue issue = board.get(issueId);
        if (issue.status().isTerminal()) {
            throw new IllegalStateException("Issue " + issueId + " is " + issue.status());
        }
        if (!agentId.equals(issue.assigneeId())) {
            throw new IllegalArgumentException("Agent " + agentId + " is not assigned to " + issueId);
        }
        return issue;
    }

    private void signalNoCapacity(Issue issue) {
        metrics.recordNoCapacity();
        log.warn("No capacity for issue {}", issue.id());
        eventBus.publish(TeamflowEvent.of(EventTypes.CAPACITY_EXHAUSTED, issue.epicId(), issue.id(), Map.of()));
    }
}

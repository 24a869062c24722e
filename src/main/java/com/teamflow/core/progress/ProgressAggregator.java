package com.teamflow.core.progress;

import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.epic.EpicStateMachine;
import com.teamflow.core.model.BlockedTaskRecord;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.IssueStatus;
import com.teamflow.core.model.ProgressReport;
import com.teamflow.core.model.ReviewRecord;
import com.teamflow.core.model.ReviewDecision;
import com.teamflow.core.model.RiskFlag;
import com.teamflow.core.review.ReviewEngine;
import com.teamflow.core.stall.BlockedTaskRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only progress view of an epic: completion, velocity and risk flags.
 */
@Service
public class ProgressAggregator {

    static final Duration VELOCITY_WINDOW = Duration.ofDays(7);

    private final EpicStateMachine epics;
    private final IssueBoard board;
    private final BlockedTaskRegistry blocked;
    private final ReviewEngine reviews;
    private final Clock clock;

    public ProgressAggregator(EpicStateMachine epics, IssueBoard board, BlockedTaskRegistry blocked,
                              ReviewEngine reviews, Clock clock) {
        this.epics = epics;
        this.board = board;
        this.blocked = blocked;
        this.reviews = reviews;
        this.clock = clock;
    }

    public ProgressReport report(String epicId) {
        return report(epics.get(epicId), board.byEpic(epicId), blocked.forEpic(epicId), reviews.forEpic(epicId));
    }

    /**
     * Computes a report from explicit state, e.g. a saved snapshot that is not loaded.
     */
    public ProgressReport report(Epic epic, List<Issue> issues, List<BlockedTaskRecord> stalls,
                                 List<ReviewRecord> reviewRecords) {
        String epicId = epic.id();
        Instant now = clock.instant();
        Map<String, Issue> byId = new HashMap<>();
        issues.forEach(i -> byId.put(i.id(), i));

        Map<IssueStatus, Integer> byStatus = new EnumMap<>(IssueStatus.class);
        for (IssueStatus status : IssueStatus.values()) {
            byStatus.put(status, 0);
        }
        int available = 0;
        int waitingOnDependencies = 0;
        int doneRecently = 0;
        Instant windowStart = now.minus(VELOCITY_WINDOW);
        for (Issue issue : issues) {
            byStatus.merge(issue.status(), 1, Integer::sum);
            if (issue.status() == IssueStatus.OPEN) {
                if (dependenciesMet(issue, byId)) {
                    available++;
                } else {
                    waitingOnDependencies++;
                }
            }
            if (issue.status() == IssueStatus.DONE && issue.completedAt() != null
                    && issue.completedAt().isAfter(windowStart)) {
                doneRecently++;
            }
        }

        int total = issues.size();
        int done = byStatus.get(IssueStatus.DONE);
        int percent = total == 0 ? 0 : (int) Math.round(done * 100.0 / total);
        int active = byStatus.get(IssueStatus.IN_PROGRESS) + byStatus.get(IssueStatus.IN_REVIEW);
        double velocity = doneRecently / (double) VELOCITY_WINDOW.toDays();
        int remaining = (int) issues.stream().filter(i -> !i.status().isTerminal()).count();

        List<RiskFlag> flags = new ArrayList<>();
        if (!stalls.isEmpty()) {
            flags.add(RiskFlag.STALLED_WORK);
        }
        boolean humanNeeded = stalls.stream().anyMatch(r -> r.stage().isFinal())
                || reviewRecords.stream().anyMatch(r -> r.decision() == ReviewDecision.ESCALATED
                        && byId.containsKey(r.issueId()) && !byId.get(r.issueId()).status().isTerminal());
        if (humanNeeded) {
            flags.add(RiskFlag.HUMAN_ESCALATION);
        }
        if (waitingOnDependencies > 0 && waitingOnDependencies > available) {
            flags.add(RiskFlag.DEPENDENCY_BOTTLENECK);
        }
        // Only judged once the epic is older than one full window.
        if (remaining > 0 && doneRecently == 0 && epic.createdAt().isBefore(windowStart)) {
            flags.add(RiskFlag.LOW_VELOCITY);
        }

        return new ProgressReport(epicId, total, byStatus, percent, active, available, waitingOnDependencies,
                velocity, List.copyOf(flags), now);
    }

    private static boolean dependenciesMet(Issue issue, Map<String, Issue> byId) {
        return issue.dependencies().stream()
                .allMatch(d -> byId.containsKey(d) && byId.get(d).status() == IssueStatus.DONE);
    }
}

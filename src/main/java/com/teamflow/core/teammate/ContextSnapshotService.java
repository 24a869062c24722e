package com.teamflow.core.teammate;

import com.teamflow.core.coordinator.AssignmentLedger;
import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.epic.EpicStateMachine;
import com.teamflow.core.error.NotFoundException;
import com.teamflow.core.logging.MdcContext;
import com.teamflow.core.model.Assignment;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicSnapshot;
import com.teamflow.core.model.Issue;
import com.teamflow.core.persistence.CoordinationRepository;
import com.teamflow.core.progress.ProgressAggregator;
import com.teamflow.core.review.ReviewEngine;
import com.teamflow.core.stall.BlockedTaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Saves an epic's full coordination context to the context store and loads it back.
 * <p>
 * Restore prefers the last explicit snapshot and otherwise reassembles the
 * context from the records written through during normal operation.
 */
@Service
public class ContextSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(ContextSnapshotService.class);

    private final CoordinationRepository repository;
    private final EpicStateMachine epics;
    private final IssueBoard board;
    private final AssignmentLedger ledger;
    private final ReviewEngine reviews;
    private final BlockedTaskRegistry blocked;
    private final ProgressAggregator progress;
    private final Clock clock;

    public ContextSnapshotService(CoordinationRepository repository, EpicStateMachine epics, IssueBoard board,
                                  AssignmentLedger ledger, ReviewEngine reviews, BlockedTaskRegistry blocked,
                                  ProgressAggregator progress, Clock clock) {
        this.repository = repository;
        this.epics = epics;
        this.board = board;
        this.ledger = ledger;
        this.reviews = reviews;
        this.blocked = blocked;
        this.progress = progress;
        this.clock = clock;
    }

    public EpicSnapshot save(String epicId, String agentId) {
        Epic epic = epics.get(epicId);
        EpicSnapshot snapshot = new EpicSnapshot(epic, board.byEpic(epicId), ledger.forEpic(epicId),
                reviews.forEpic(epicId), blocked.forEpic(epicId), agentId, clock.instant());
        repository.saveSnapshot(snapshot);
        log.info("Saved context of epic {} (v{}, {} issues)", epicId, epic.version(), snapshot.issues().size());
        return snapshot;
    }

    /**
     * Loads a saved context back into the live services.
     *
     * @param agentId required for {@link RestoreStrategy#SELECTIVE}, ignored otherwise
     * @throws NotFoundException if nothing was ever stored for the epic
     */
    public RestoreResult restore(String epicId, RestoreStrategy strategy, String agentId) {
        MdcContext.setEpic(epicId);
        try {
            EpicSnapshot snapshot = repository.loadSnapshot(epicId).orElseGet(() -> assemble(epicId));
            Epic epic = epics.restore(snapshot.epic());
            RestoreResult result = switch (strategy) {
                case FULL -> {
                    board.restore(snapshot.issues());
                    ledger.restore(snapshot.assignments());
                    reviews.restore(epicId, snapshot.reviews());
                    blocked.restore(snapshot.blocked());
                    yield new RestoreResult(epic, strategy, snapshot.issues().size(), snapshot.assignments().size(),
                            snapshot.reviews().size(), snapshot.blocked().size(), progress.report(epicId));
                }
                case SUMMARY -> new RestoreResult(epic, strategy, 0, 0, 0, 0, progress.report(epic,
                        snapshot.issues(), snapshot.blocked(), snapshot.reviews()));
                case SELECTIVE -> restoreFor(epic, snapshot, agentId);
            };
            log.info("Restored epic {} ({}): {} issues, {} assignments", epicId, strategy,
                    result.issues(), result.assignments());
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    public boolean clear(String epicId) {
        boolean removed = repository.deleteSnapshot(epicId);
        log.info("Cleared saved context of epic {}{}", epicId, removed ? "" : " (nothing saved)");
        return removed;
    }

    private RestoreResult restoreFor(Epic epic, EpicSnapshot snapshot, String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("Selective restore needs an agent id");
        }
        List<Issue> mine = snapshot.issues().stream()
                .filter(i -> agentId.equals(i.assigneeId()))
                .toList();
        Set<String> ids = mine.stream().map(Issue::id).collect(Collectors.toSet());
        List<Assignment> assignments = snapshot.assignments().stream()
                .filter(a -> ids.contains(a.issueId()))
                .toList();
        board.restore(mine);
        ledger.restore(assignments);
        return new RestoreResult(epic, RestoreStrategy.SELECTIVE, mine.size(), assignments.size(), 0, 0,
                progress.report(epic, snapshot.issues(), snapshot.blocked(), snapshot.reviews()));
    }

    private EpicSnapshot assemble(String epicId) {
        Epic epic = repository.loadEpic(epicId)
                .orElseThrow(() -> new NotFoundException("No saved context for epic " + epicId));
        return new EpicSnapshot(epic, repository.loadIssues(epicId), repository.loadAssignments(epicId),
                repository.loadReviews(epicId), repository.loadBlocked(epicId), null, clock.instant());
    }
}

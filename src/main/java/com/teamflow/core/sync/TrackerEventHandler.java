package com.teamflow.core.sync;

import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.coordinator.TaskCoordinator;
import com.teamflow.core.epic.EpicStateMachine;
import com.teamflow.core.error.StaleEventException;
import com.teamflow.core.logging.MdcContext;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.WorkRequirements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Applies normalized tracker events to local issues.
 * <p>
 * New tracker issues are filed under the epic named by an {@code epic:<id>} label,
 * or under the event's epic hint. Changes older than the local copy are rejected
 * with {@link StaleEventException}.
 */
@Service
public class TrackerEventHandler {

    private static final Logger log = LoggerFactory.getLogger(TrackerEventHandler.class);

    public static final String EPIC_LABEL_PREFIX = "epic:";

    private final IssueBoard board;
    private final TaskCoordinator coordinator;
    private final EpicStateMachine epics;
    private final WorkRequirementExtractor extractor;

    public TrackerEventHandler(IssueBoard board, TaskCoordinator coordinator, EpicStateMachine epics,
                               WorkRequirementExtractor extractor) {
        this.board = board;
        this.coordinator = coordinator;
        this.epics = epics;
        this.extractor = extractor;
    }

    public static String issueId(int number) {
        return "issue-" + number;
    }

    public void handle(TrackerEvent event) {
        TrackerIssue remote = event.issue();
        Optional<Issue> known = board.findByNumber(remote.number());
        known.ifPresent(i -> MdcContext.setIssue(i.epicId(), i.id()));
        try {
            if (known.isEmpty()) {
                if (event.type() != TrackerEvent.Type.CLOSED && !remote.isClosed()) {
                    create(event);
                }
                return;
            }
            Issue local = known.get();
            requireFresh(local, remote);
            if (event.type() == TrackerEvent.Type.CLOSED || remote.isClosed()) {
                coordinator.closeExternally(local.id());
                return;
            }
            WorkRequirements requirements = extractor.extract(remote);
            board.update(local.id(), i -> i.withContent(remote.title(), remote.body(), requirements,
                    remote.updatedAt()));
            log.info("Updated {} from tracker #{} ({})", local.id(), remote.number(), event.type());
        } finally {
            MdcContext.clear();
        }
    }

    private void create(TrackerEvent event) {
        TrackerIssue remote = event.issue();
        String epicId = epicLabel(remote).orElse(event.epicHint());
        if (epicId == null) {
            log.debug("Tracker issue #{} has no epic; ignoring", remote.number());
            return;
        }
        if (epics.find(epicId).isEmpty()) {
            log.warn("Tracker issue #{} names unknown epic {}; ignoring", remote.number(), epicId);
            return;
        }
        boolean isEpicItself = epics.list(null, null).stream()
                .anyMatch(e -> e.externalRef() != null && e.externalRef() == remote.number());
        if (isEpicItself) {
            return;
        }
        WorkRequirements requirements = extractor.extract(remote);
        Issue issue = Issue.open(issueId(remote.number()), epicId, remote.number(), remote.title(), requirements)
                .withContent(remote.title(), remote.body(), requirements, remote.updatedAt());
        board.put(issue);
        log.info("Imported tracker #{} as {} in epic {}", remote.number(), issue.id(), epicId);
    }

    private static void requireFresh(Issue local, TrackerIssue remote) {
        if (local.trackerUpdatedAt() != null && remote.updatedAt() != null
                && !remote.updatedAt().isAfter(local.trackerUpdatedAt())) {
            throw new StaleEventException("Tracker #" + remote.number() + " at " + remote.updatedAt()
                    + " is not newer than local copy at " + local.trackerUpdatedAt());
        }
    }

    static Optional<String> epicLabel(TrackerIssue issue) {
        return issue.labels().stream()
                .filter(l -> l.toLowerCase(Locale.ROOT).startsWith(EPIC_LABEL_PREFIX))
                .map(l -> l.substring(EPIC_LABEL_PREFIX.length()).trim())
                .filter(s -> !s.isEmpty())
                .findFirst();
    }
}

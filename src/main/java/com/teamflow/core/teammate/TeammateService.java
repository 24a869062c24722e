package com.teamflow.core.teammate;

import com.teamflow.core.agent.AgentRegistry;
import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.coordinator.AssignmentLedger;
import com.teamflow.core.coordinator.AutoAssignResult;
import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.coordinator.TaskCoordinator;
import com.teamflow.core.epic.EpicStateMachine;
import com.teamflow.core.error.AlreadyClaimedException;
import com.teamflow.core.error.ExternalSyncFailureException;
import com.teamflow.core.error.LockTimeoutException;
import com.teamflow.core.error.NoCapacityException;
import com.teamflow.core.model.Assignment;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.model.Issue;
import com.teamflow.core.sync.TrackerIssue;
import com.teamflow.core.sync.TrackerPoller;
import com.teamflow.core.sync.TrackerSync;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for the {@code epic} and {@code teammate} commands and the epic REST endpoints.
 */
@Service
public class TeammateService {

    private static final Logger log = LoggerFactory.getLogger(TeammateService.class);
    private static final long SYNC_WAIT_SECONDS = 60;

    private final TeamflowProperties properties;
    private final EpicStateMachine epics;
    private final TaskCoordinator coordinator;
    private final IssueBoard board;
    private final AssignmentLedger ledger;
    private final AgentRegistry agents;
    private final TrackerSync trackerSync;
    private final TrackerPoller poller;

    public TeammateService(TeamflowProperties properties, EpicStateMachine epics, TaskCoordinator coordinator,
                           IssueBoard board, AssignmentLedger ledger, AgentRegistry agents, TrackerSync trackerSync,
                           TrackerPoller poller) {
        this.properties = properties;
        this.epics = epics;
        this.coordinator = coordinator;
        this.board = board;
        this.ledger = ledger;
        this.agents = agents;
        this.trackerSync = trackerSync;
        this.poller = poller;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    /**
     * Creates an epic, optionally activating it straight away.
     */
    public Epic createEpic(String title, String description, List<String> objectives, List<String> constraints,
                           Integer externalRef, boolean activate) {
        Epic epic = epics.create(title, description, objectives, constraints, externalRef);
        if (activate) {
            epic = epics.transition(epic.id(), EpicState.ACTIVE, null, "activated on creation");
        }
        return epic;
    }

    public List<Epic> listEpics(EpicState state, Instant createdAfter) {
        return epics.list(state, createdAfter);
    }

    public Epic getEpic(String epicId) {
        return epics.get(epicId);
    }

    public Epic updateEpic(String epicId, String title, String description, List<String> objectives,
                           List<String> constraints, Long expectedVersion) {
        return epics.update(epicId, title, description, objectives, constraints, expectedVersion);
    }

    public Epic transitionEpic(String epicId, EpicState target, String reason) {
        return epics.transition(epicId, target, null, reason);
    }

    /**
     * Pulls tracker changes into the epic and waits until they are applied.
     *
     * @throws ExternalSyncFailureException if the changes are not applied in time
     */
    public SyncResult syncEpic(String epicId) {
        Epic epic = epics.get(epicId);
        boolean refreshed = false;
        if (epic.externalRef() != null) {
            Optional<TrackerIssue> remote = trackerSync.fetchIfChanged(epic.externalRef());
            if (remote.isPresent()) {
                epics.update(epicId, remote.get().title(), remote.get().body(), null, null, null);
                refreshed = true;
            }
        }
        List<CompletableFuture<Boolean>> queued = poller.poll(null, epicId);
        try {
            CompletableFuture.allOf(queued.toArray(new CompletableFuture[0])).get(SYNC_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            throw new ExternalSyncFailureException("Tracker changes for epic " + epicId + " not applied within "
                    + SYNC_WAIT_SECONDS + "s", e);
        } catch (ExecutionException e) {
            throw new ExternalSyncFailureException("Applying tracker changes for epic " + epicId + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalSyncFailureException("Interrupted while syncing epic " + epicId, e);
        }
        int applied = (int) queued.stream().filter(f -> Boolean.TRUE.equals(f.getNow(false))).count();
        log.info("Synced epic {}: {} change(s) queued, {} applied", epicId, queued.size(), applied);
        return new SyncResult(epicId, refreshed, queued.size(), applied);
    }

    /**
     * Assigns one issue, or every ready issue of the epic when {@code issueId} is null.
     */
    public List<AutoAssignResult> assign(String epicId, String issueId) {
        epics.get(epicId);
        if (issueId == null) {
            return coordinator.autoAssign(epicId);
        }
        try {
            Assignment a = coordinator.assignNext(issueId);
            return List.of(new AutoAssignResult(issueId, AutoAssignResult.Outcome.ASSIGNED, a.agentId(), null));
        } catch (NoCapacityException e) {
            return List.of(new AutoAssignResult(issueId, AutoAssignResult.Outcome.NO_CAPACITY, null, e.getMessage()));
        } catch (AlreadyClaimedException | LockTimeoutException e) {
            return List.of(new AutoAssignResult(issueId, AutoAssignResult.Outcome.CONTENTION, null, e.getMessage()));
        }
    }

    /**
     * Hands one issue of the epic to a named agent, bypassing scoring.
     */
    public Assignment claim(String epicId, String issueId, String agentId) {
        epics.get(epicId);
        Issue issue = board.get(issueId);
        if (!epicId.equals(issue.epicId())) {
            throw new IllegalArgumentException("Issue " + issueId + " does not belong to " + epicId);
        }
        return coordinator.claimIssue(agentId, issueId);
    }

    public TeammateStatus status() {
        int liveEpics = (int) epics.list(null, null).stream()
                .filter(e -> e.state() != EpicState.ARCHIVED)
                .count();
        return new TeammateStatus(isEnabled(), liveEpics, agents.size(), ledger.activeCount(),
                trackerSync.isConfigured());
    }
}

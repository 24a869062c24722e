package com.teamflow.core.stall;

import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.coordinator.TaskCoordinator;
import com.teamflow.core.epic.EpicStateMachine;
import com.teamflow.core.error.NoCapacityException;
import com.teamflow.core.model.BlockedTaskRecord;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.model.EscalationStage;
import com.teamflow.core.model.Issue;
import com.teamflow.core.sync.TrackerSync;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Performs the action for the next rung of a stalled issue's escalation and returns the advanced record.
 * <p>
 * One rung per call, except that a reassignment with no qualifying agent goes
 * straight on to human escalation in the same call.
 */
@Component
public class EscalationLadder {

    private static final Logger log = LoggerFactory.getLogger(EscalationLadder.class);

    private final AgentChannel agentChannel;
    private final TaskCoordinator coordinator;
    private final IssueBoard board;
    private final EpicStateMachine epics;
    private final TrackerSync trackerSync;

    public EscalationLadder(AgentChannel agentChannel, TaskCoordinator coordinator, IssueBoard board,
                            EpicStateMachine epics, TrackerSync trackerSync) {
        this.agentChannel = agentChannel;
        this.coordinator = coordinator;
        this.board = board;
        this.epics = epics;
        this.trackerSync = trackerSync;
    }

    public BlockedTaskRecord climb(BlockedTaskRecord record, Issue issue, Duration stall, Instant now) {
        if (record.stage().isFinal()) {
            return record.observed(stall);
        }
        EscalationStage target = record.stage().next();
        return switch (target) {
            case NOTIFIED -> {
                agentChannel.requestStatus(record.agentId(), issue.id(), issue.epicId());
                yield record.advance(stall, now, "status requested from " + record.agentId());
            }
            case AUTO_RECOVERY_ATTEMPTED -> record.advance(stall, now, recover(record, issue));
            case REASSIGNED -> reassign(record, issue, stall, now);
            case ESCALATED_TO_HUMAN -> escalate(record, issue, stall, now, "reassignment did not recover the issue");
            case DETECTED -> throw new IllegalStateException("DETECTED is never a climb target");
        };
    }

    private String recover(BlockedTaskRecord record, Issue issue) {
        String agentId = record.agentId();
        switch (record.reason()) {
            case ERROR_THRESHOLD -> {
                agentChannel.restart(agentId, issue.id(), issue.epicId());
                return "restart requested for " + agentId;
            }
            case RESOURCE_EXHAUSTION -> {
                agentChannel.freeResources(agentId, issue.id(), issue.epicId());
                return "resource release requested for " + agentId;
            }
            case DEPENDENCY_WAIT -> {
                return board.dependenciesMet(issue)
                        ? "dependencies are now available"
                        : "dependencies still pending: " + issue.dependencies();
            }
            default -> {
                agentChannel.wake(agentId, issue.id(), issue.epicId());
                return "wake signal sent to " + agentId;
            }
        }
    }

    private BlockedTaskRecord reassign(BlockedTaskRecord record, Issue issue, Duration stall, Instant now) {
        try {
            return coordinator.reassign(issue.id(), Set.of(record.agentId()), "stalled: " + record.reason())
                    .map(a -> record.advance(stall, now, "reassigned to " + a.agentId()))
                    .orElseGet(() -> record.advance(stall, now, "issue no longer held by " + record.agentId()));
        } catch (NoCapacityException e) {
            log.warn("No agent can take over stalled issue {}; escalating to a human", issue.id());
            BlockedTaskRecord reassignFailed = record.advance(stall, now, "no alternative agent: " + e.getMessage());
            return escalate(reassignFailed, issue, stall, now, "no alternative agent qualified");
        }
    }

    private BlockedTaskRecord escalate(BlockedTaskRecord record, Issue issue, Duration stall, Instant now,
                                       String why) {
        String diagnostic = diagnostic(record, issue, stall, why);
        trackerSync.escalateToHuman(issue.number(), diagnostic);
        epics.transitionIf(issue.epicId(), EpicState.ACTIVE, EpicState.BLOCKED,
                "issue " + issue.id() + " escalated to a human");
        log.warn("Issue {} escalated to a human: {}", issue.id(), why);
        return record.advance(stall, now, why);
    }

    static String diagnostic(BlockedTaskRecord record, Issue issue, Duration stall, String why) {
        return String.join("\n",
                "Stalled work needs a human.",
                "",
                "- Issue: " + issue.id() + " (" + issue.title() + ")",
                "- Priority: " + issue.priority(),
                "- Status: " + issue.status(),
                "- Agent: " + record.agentId(),
                "- Current assignee: " + (issue.assigneeId() == null ? "none" : issue.assigneeId()),
                "- Reason: " + record.reason(),
                "- Stalled for: " + stall.toMinutes() + " min",
                "- First detected: " + record.detectedAt(),
                "- Last action: " + (record.note() == null ? "none" : record.note()),
                "- Escalated because: " + why);
    }
}

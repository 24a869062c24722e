package com.teamflow.core.stall;

import com.teamflow.core.agent.AgentErrorHistory;
import com.teamflow.core.agent.AgentRegistry;
import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.events.EventBus;
import com.teamflow.core.events.EventTypes;
import com.teamflow.core.events.TeamflowEvent;
import com.teamflow.core.logging.MdcContext;
import com.teamflow.core.metrics.TeamflowMetrics;
import com.teamflow.core.model.AgentProfile;
import com.teamflow.core.model.BlockedTaskRecord;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.StallReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scans in-flight issues for inactivity and drives each stalled one up the {@link EscalationLadder}.
 * <p>
 * The first pass that finds an issue stale creates a level-0 record. Every later
 * pass that still finds it stale climbs one rung. The record is deleted when the
 * issue leaves in-flight, or when an agent reports activity within the priority
 * threshold. The claim made by a reassignment is not such activity.
 */
@Service
public class StallDetector {

    private static final Logger log = LoggerFactory.getLogger(StallDetector.class);

    private final IssueBoard board;
    private final AgentRegistry agents;
    private final AgentErrorHistory errorHistory;
    private final BlockedTaskRegistry registry;
    private final EscalationLadder ladder;
    private final EventBus eventBus;
    private final TeamflowMetrics metrics;
    private final Clock clock;
    private final TeamflowProperties.Stall config;

    public StallDetector(IssueBoard board, AgentRegistry agents, AgentErrorHistory errorHistory,
                         BlockedTaskRegistry registry, EscalationLadder ladder, EventBus eventBus,
                         TeamflowMetrics metrics, Clock clock, TeamflowProperties properties) {
        this.board = board;
        this.agents = agents;
        this.errorHistory = errorHistory;
        this.registry = registry;
        this.ladder = ladder;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.config = properties.getStall();
    }

    @Scheduled(fixedDelayString = "${teamflow.stall.interval-ms:60000}")
    public void scan() {
        scanAt(clock.instant());
    }

    /**
     * Runs one detection pass.
     *
     * @return records created or advanced in this pass
     */
    public List<BlockedTaskRecord> scanAt(Instant now) {
        List<Issue> inFlight = board.inFlight();
        Set<String> inFlightIds = inFlight.stream().map(Issue::id).collect(Collectors.toSet());
        for (BlockedTaskRecord record : registry.all()) {
            if (!inFlightIds.contains(record.issueId())) {
                registry.recovered(record.issueId());
                log.info("Dropping stall record for {}: no longer in flight", record.issueId());
            }
        }

        List<BlockedTaskRecord> changed = new ArrayList<>();
        for (Issue issue : inFlight) {
            MdcContext.setClaim(issue.epicId(), issue.id(), issue.assigneeId());
            try {
                inspect(issue, now).ifPresent(changed::add);
            } catch (RuntimeException e) {
                log.error("Stall check failed for issue {}", issue.id(), e);
            } finally {
                MdcContext.clear();
            }
        }
        return changed;
    }

    private Optional<BlockedTaskRecord> inspect(Issue issue, Instant now) {
        Instant lastActivity = issue.lastActivityAt() != null ? issue.lastActivityAt() : issue.claimedAt();
        if (lastActivity == null) {
            return Optional.empty();
        }
        Duration stall = Duration.between(lastActivity, now);
        Duration threshold = config.thresholdFor(issue.priority());
        Optional<BlockedTaskRecord> existing = registry.find(issue.id());

        if (stall.compareTo(threshold) <= 0) {
            if (existing.isPresent() && freshActivity(issue, existing.get()) && registry.recovered(issue.id())) {
                log.info("Issue {} recovered after reaching {}", issue.id(), existing.get().stage());
            }
            return Optional.empty();
        }

        if (existing.isEmpty()) {
            StallReason reason = classify(issue);
            BlockedTaskRecord record = registry.save(BlockedTaskRecord.detected(issue, stall, reason, now));
            metrics.recordStallDetected(reason.name());
            log.info("Issue {} stalled for {} min (threshold {} min): {}", issue.id(), stall.toMinutes(),
                    threshold.toMinutes(), reason);
            eventBus.publish(TeamflowEvent.of(EventTypes.STALL_DETECTED, issue.epicId(), issue.id(),
                    Map.of("agentId", String.valueOf(issue.assigneeId()), "reason", reason.name(),
                            "stallMinutes", stall.toMinutes())));
            return Optional.of(record);
        }

        BlockedTaskRecord current = existing.get();
        if (current.stage().isFinal()) {
            registry.save(current.observed(stall));
            return Optional.empty();
        }
        BlockedTaskRecord advanced = registry.save(ladder.climb(current, issue, stall, now));
        metrics.recordEscalation(advanced.level());
        log.info("Issue {} escalated to {}: {}", issue.id(), advanced.stage(), advanced.note());
        eventBus.publish(TeamflowEvent.of(EventTypes.STALL_ESCALATED, issue.epicId(), issue.id(),
                Map.of("level", advanced.level(), "stage", advanced.stage().name(),
                        "note", advanced.note() == null ? "" : advanced.note())));
        return Optional.of(advanced);
    }

    /**
     * Whether the issue shows activity an agent reported after its claim. A record already
     * handed to a human also needs that activity to postdate the hand-off.
     */
    static boolean freshActivity(Issue issue, BlockedTaskRecord record) {
        Instant last = issue.lastActivityAt();
        if (last == null || (issue.claimedAt() != null && !last.isAfter(issue.claimedAt()))) {
            return false;
        }
        return !record.stage().isFinal() || last.isAfter(record.lastEscalatedAt());
    }

    StallReason classify(Issue issue) {
        String agentId = issue.assigneeId();
        if (agentId != null && errorHistory.size(agentId) > 0
                && errorHistory.failureRatio(agentId, config.getErrorWindow()) >= config.getErrorRatio()) {
            return StallReason.ERROR_THRESHOLD;
        }
        Optional<AgentProfile> agent = agentId == null ? Optional.empty() : agents.find(agentId);
        if (agent.isPresent() && agent.get().resourceHealth() < config.getResourceFloor()) {
            return StallReason.RESOURCE_EXHAUSTION;
        }
        if (!board.dependenciesMet(issue)) {
            return StallReason.DEPENDENCY_WAIT;
        }
        return StallReason.NO_ACTIVITY;
    }
}

package com.teamflow.support;

import com.teamflow.core.agent.AgentErrorHistory;
import com.teamflow.core.agent.AgentRegistry;
import com.teamflow.core.balancer.FairnessBalancer;
import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.coordinator.AssignmentLedger;
import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.coordinator.IssueLockManager;
import com.teamflow.core.coordinator.TaskCoordinator;
import com.teamflow.core.epic.BlockedEpicHook;
import com.teamflow.core.epic.CompletedEpicHook;
import com.teamflow.core.epic.EpicStateMachine;
import com.teamflow.core.epic.ResumedEpicHook;
import com.teamflow.core.events.EventBus;
import com.teamflow.core.events.TeamflowEvent;
import com.teamflow.core.metrics.TeamflowMetrics;
import com.teamflow.core.model.Capability;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.model.Issue;
import com.teamflow.core.persistence.CoordinationRepository;
import com.teamflow.core.persistence.InMemoryContextStore;
import com.teamflow.core.progress.ProgressAggregator;
import com.teamflow.core.review.ReviewEngine;
import com.teamflow.core.scoring.ScoringEngine;
import com.teamflow.core.stall.BlockedTaskRegistry;
import com.teamflow.core.stall.EscalationLadder;
import com.teamflow.core.stall.EventBusAgentChannel;
import com.teamflow.core.stall.StallDetector;
import com.teamflow.core.sync.IssueTrackerClient;
import com.teamflow.core.sync.TrackerRetry;
import com.teamflow.core.sync.TrackerSync;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.mockito.Mockito.mock;

/**
 * Wires the coordination services together over an in-memory store, with a
 * mocked tracker client that reports itself as unconfigured unless stubbed.
 */
public class Harness {

    public final TeamflowProperties properties;
    public final MutableClock clock;
    public final InMemoryContextStore store;
    public final CoordinationRepository repository;
    public final EventBus eventBus = new EventBus();
    public final List<TeamflowEvent> events = new CopyOnWriteArrayList<>();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final TeamflowMetrics metrics = new TeamflowMetrics(meterRegistry);
    public final IssueTrackerClient trackerClient = mock(IssueTrackerClient.class);
    public final TrackerSync trackerSync;
    public final AgentRegistry agents;
    public final AgentErrorHistory errorHistory = new AgentErrorHistory();
    public final ScoringEngine scoring;
    public final FairnessBalancer balancer;
    public final IssueBoard board;
    public final AssignmentLedger ledger;
    public final IssueLockManager locks;
    public final EpicStateMachine epics;
    public final ReviewEngine reviews;
    public final TaskCoordinator coordinator;
    public final BlockedTaskRegistry blocked;
    public final EscalationLadder ladder;
    public final StallDetector stallDetector;
    public final ProgressAggregator progress;

    public Harness() {
        this(new TeamflowProperties());
    }

    public Harness(TeamflowProperties properties) {
        this(properties, MutableClock.at("2026-03-01T09:00:00Z"), null);
    }

    /** Fresh services over the clock and store of {@code previous}, as after a process restart. */
    public static Harness restartedFrom(Harness previous) {
        return new Harness(previous.properties, previous.clock, previous.store);
    }

    private Harness(TeamflowProperties properties, MutableClock clock, InMemoryContextStore store) {
        this.properties = properties;
        this.clock = clock;
        this.store = store != null ? store : new InMemoryContextStore(clock);
        repository = new CoordinationRepository(this.store, properties);
        trackerSync = new TrackerSync(trackerClient, metrics, TrackerRetry.create("tracker", 1, Duration.ofMillis(1)));
        agents = new AgentRegistry(properties, clock);
        scoring = new ScoringEngine(properties);
        balancer = new FairnessBalancer(scoring, properties);
        board = new IssueBoard(repository);
        ledger = new AssignmentLedger(repository);
        locks = new IssueLockManager(properties);
        epics = new EpicStateMachine(repository, eventBus, metrics, clock, List.of(
                new BlockedEpicHook(trackerSync, eventBus),
                new CompletedEpicHook(trackerSync),
                new ResumedEpicHook(trackerSync)));
        reviews = new ReviewEngine(properties, agents, ledger, board, repository, trackerSync, eventBus, metrics, clock);
        blocked = new BlockedTaskRegistry(repository);
        coordinator = new TaskCoordinator(board, ledger, locks, agents, errorHistory, scoring, balancer, epics,
                reviews, trackerSync, blocked, eventBus, metrics, clock, properties);
        ladder = new EscalationLadder(new EventBusAgentChannel(eventBus), coordinator, board, epics, trackerSync);
        stallDetector = new StallDetector(board, agents, errorHistory, blocked, ladder, eventBus, metrics, clock,
                properties);
        progress = new ProgressAggregator(epics, board, blocked, reviews, clock);
        eventBus.subscribeAll(events::add);
    }

    public Epic activeEpic(String title) {
        Epic epic = epics.create(title, "", List.of(), List.of(), null);
        return epics.transition(epic.id(), EpicState.ACTIVE, null, "test");
    }

    public void register(String agentId, String... capabilities) {
        agents.register(agentId, "coder", Fixtures.caps(capabilities), null);
    }

    public void register(String agentId, Set<Capability> capabilities, int maxConcurrentTasks) {
        agents.register(agentId, "coder", capabilities, maxConcurrentTasks);
    }

    public Issue addIssue(Issue issue) {
        return board.put(issue);
    }

    public List<TeamflowEvent> eventsOfType(String eventType) {
        return events.stream().filter(e -> e.eventType().equals(eventType)).toList();
    }
}

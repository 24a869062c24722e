package com.teamflow.core.epic;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.error.InvalidTransitionException;
import com.teamflow.core.error.NotFoundException;
import com.teamflow.core.error.VersionConflictException;
import com.teamflow.core.events.EventBus;
import com.teamflow.core.events.EventTypes;
import com.teamflow.core.events.TeamflowEvent;
import com.teamflow.core.metrics.TeamflowMetrics;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.persistence.CoordinationRepository;
import com.teamflow.core.persistence.InMemoryContextStore;
import com.teamflow.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class EpicStateMachineTest {

    private MutableClock clock;
    private CoordinationRepository repository;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private TransitionHook blockedHook;
    private EpicStateMachine machine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        repository = new CoordinationRepository(new InMemoryContextStore(clock), new TeamflowProperties());
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        blockedHook = mock(TransitionHook.class);
        when(blockedHook.target()).thenReturn(EpicState.BLOCKED);
        machine = new EpicStateMachine(repository, eventBus, new TeamflowMetrics(registry), clock,
                List.of(blockedHook));
    }

    private Epic activeEpic() {
        Epic epic = machine.create("Auth", "Login flow", List.of("ship login"), List.of(), null);
        return machine.transition(epic.id(), EpicState.ACTIVE, null, "start");
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("starts uninitialized at version 0 and is persisted")
        void initialState() {
            Epic epic = machine.create("Auth", null, null, null, 12);

            assertEquals(EpicState.UNINITIALIZED, epic.state());
            assertEquals(0L, epic.version());
            assertTrue(epic.id().startsWith("epic-"));
            assertEquals(epic, repository.loadEpic(epic.id()).orElseThrow());
        }

        @Test
        @DisplayName("unknown epic raises NotFoundException")
        void unknown() {
            assertThrows(NotFoundException.class, () -> machine.get("epic-missing"));
        }
    }

    @Nested
    @DisplayName("transition")
    class Transition {

        @Test
        @DisplayName("allowed move bumps the version by exactly one")
        void bumpsVersion() {
            Epic active = activeEpic();
            clock.advance(Duration.ofMinutes(5));

            Epic paused = machine.transition(active.id(), EpicState.PAUSED, null, "holiday");

            assertEquals(EpicState.PAUSED, paused.state());
            assertEquals(active.version() + 1, paused.version());
            assertEquals(clock.instant(), paused.updatedAt());
        }

        @Test
        @DisplayName("illegal move throws and mutates nothing")
        void illegal() {
            Epic epic = machine.create("Auth", null, null, null, null);

            assertThrows(InvalidTransitionException.class,
                    () -> machine.transition(epic.id(), EpicState.COMPLETED, null, null));
            assertEquals(epic, machine.get(epic.id()));
        }

        @Test
        @DisplayName("ARCHIVED has no way out")
        void archivedIsAbsorbing() {
            Epic epic = activeEpic();
            machine.transition(epic.id(), EpicState.PAUSED, null, null);
            machine.transition(epic.id(), EpicState.ARCHIVED, null, null);

            for (EpicState target : EpicState.values()) {
                assertThrows(InvalidTransitionException.class,
                        () -> machine.transition(epic.id(), target, null, null), "ARCHIVED -> " + target);
            }
        }

        @Test
        @DisplayName("a repeated event id is a no-op")
        void duplicateEvent() {
            Epic epic = activeEpic();

            Epic first = machine.transition(epic.id(), EpicState.REVIEW, "evt-1", null);
            Epic second = machine.transition(epic.id(), EpicState.REVIEW, "evt-1", null);

            assertEquals(first.version(), second.version());
            assertEquals(EpicState.REVIEW, second.state());
        }

        @Test
        @DisplayName("runs the hook of the target state before committing")
        void runsHook() {
            Epic epic = activeEpic();

            machine.transition(epic.id(), EpicState.BLOCKED, null, "waiting on infra");

            verify(blockedHook).onEnter(any(Epic.class), eq(EpicState.ACTIVE), eq("waiting on infra"));
        }

        @Test
        @DisplayName("a failing hook aborts the transition")
        void hookFailureAborts() {
            Epic epic = activeEpic();
            doThrow(new IllegalStateException("tracker down"))
                    .when(blockedHook).onEnter(any(Epic.class), any(EpicState.class), anyString());

            assertThrows(IllegalStateException.class,
                    () -> machine.transition(epic.id(), EpicState.BLOCKED, null, "x"));
            assertEquals(EpicState.ACTIVE, machine.get(epic.id()).state());
            assertEquals(epic.version(), machine.get(epic.id()).version());
        }

        @Test
        @DisplayName("publishes a transition event and counts it")
        void publishes() {
            List<TeamflowEvent> events = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(events::add);

            Epic epic = activeEpic();

            assertEquals(EventTypes.EPIC_TRANSITIONED, events.get(0).eventType());
            assertEquals(epic.id(), events.get(0).epicId());
            assertEquals("ACTIVE", events.get(0).payload().get("to"));
            assertEquals(1.0, registry.find("teamflow.epic.transitions").tag("to", "active").counter().count());
        }

        @Test
        @DisplayName("transitionIf only moves from the expected state")
        void conditional() {
            Epic epic = activeEpic();

            assertTrue(machine.transitionIf(epic.id(), EpicState.PAUSED, EpicState.ACTIVE, null).isEmpty());
            assertEquals(EpicState.REVIEW,
                    machine.transitionIf(epic.id(), EpicState.ACTIVE, EpicState.REVIEW, null).orElseThrow().state());
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("keeps unspecified fields and bumps the version")
        void partialUpdate() {
            Epic epic = activeEpic();

            Epic updated = machine.update(epic.id(), "Auth v2", null, null, List.of("no new deps"), epic.version());

            assertEquals("Auth v2", updated.title());
            assertEquals("Login flow", updated.description());
            assertEquals(List.of("no new deps"), updated.constraints());
            assertEquals(epic.version() + 1, updated.version());
        }

        @Test
        @DisplayName("stale expected version raises VersionConflictException")
        void staleVersion() {
            Epic epic = activeEpic();
            machine.update(epic.id(), "one", null, null, null, epic.version());

            assertThrows(VersionConflictException.class,
                    () -> machine.update(epic.id(), "two", null, null, null, epic.version()));
        }
    }

    @Nested
    @DisplayName("list and restore")
    class ListAndRestore {

        @Test
        @DisplayName("filters by state, newest first")
        void list() {
            Epic a = activeEpic();
            clock.advance(Duration.ofMinutes(1));
            Epic b = machine.create("Billing", null, null, null, null);

            assertEquals(List.of(b.id(), a.id()), machine.list(null, null).stream().map(Epic::id).toList());
            assertEquals(List.of(a.id()), machine.list(EpicState.ACTIVE, null).stream().map(Epic::id).toList());
        }

        @Test
        @DisplayName("restore never moves the version backwards")
        void restoreKeepsVersion() {
            Epic epic = activeEpic();
            Epic stale = epic.withVersion(0);
            machine.update(epic.id(), "newer", null, null, null, null);

            Epic restored = machine.restore(stale);

            assertTrue(restored.version() >= 2);
        }

        @Test
        @DisplayName("a fresh machine reads epics back from the store")
        void reload() {
            Epic epic = activeEpic();
            var fresh = new EpicStateMachine(repository, eventBus, new TeamflowMetrics(registry), clock, List.of());

            assertEquals(EpicState.ACTIVE, fresh.get(epic.id()).state());
            assertTrue(fresh.acceptsAssignments(epic.id()));
        }
    }
}

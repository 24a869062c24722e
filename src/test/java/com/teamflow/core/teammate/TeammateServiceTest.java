package com.teamflow.core.teammate;

import com.teamflow.core.coordinator.AutoAssignResult;
import com.teamflow.core.error.ExternalSyncFailureException;
import com.teamflow.core.model.Assignment;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.sync.FetchResult;
import com.teamflow.core.sync.TrackerIssue;
import com.teamflow.core.sync.TrackerPoller;
import com.teamflow.support.Fixtures;
import com.teamflow.support.Harness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TeammateServiceTest {

    private Harness h;
    private TrackerPoller poller;
    private TeammateService service;

    @BeforeEach
    void setUp() {
        h = new Harness();
        poller = mock(TrackerPoller.class);
        service = new TeammateService(h.properties, h.epics, h.coordinator, h.board, h.ledger, h.agents, h.trackerSync,
                poller);
    }

    @Nested
    @DisplayName("Epics")
    class Epics {

        @Test
        @DisplayName("Creating with activate moves the epic straight to ACTIVE")
        void createActive() {
            Epic epic = service.createEpic("Auth", "login", List.of("ship"), List.of(), null, true);

            assertEquals(EpicState.ACTIVE, epic.state());
            assertEquals(EpicState.ACTIVE, service.getEpic(epic.id()).state());
        }

        @Test
        void createInactive() {
            Epic epic = service.createEpic("Auth", "", List.of(), List.of(), null, false);

            assertEquals(EpicState.UNINITIALIZED, epic.state());
            assertEquals(List.of(epic), service.listEpics(EpicState.UNINITIALIZED, null));
        }
    }

    @Nested
    @DisplayName("Assign")
    class Assign {

        private Epic epic;

        @BeforeEach
        void epicWithIssue() {
            epic = h.activeEpic("Auth");
            h.addIssue(Fixtures.issue("i-1", epic.id(), "java"));
        }

        @Test
        @DisplayName("A named issue goes to the best agent")
        void assignOne() {
            h.register("alice", "java");

            List<AutoAssignResult> results = service.assign(epic.id(), "i-1");

            assertEquals(1, results.size());
            assertEquals(AutoAssignResult.Outcome.ASSIGNED, results.get(0).outcome());
            assertEquals("alice", results.get(0).agentId());
        }

        @Test
        @DisplayName("No agents -> NO_CAPACITY result instead of an exception")
        void noCapacity() {
            List<AutoAssignResult> results = service.assign(epic.id(), "i-1");

            assertEquals(AutoAssignResult.Outcome.NO_CAPACITY, results.get(0).outcome());
            assertNotNull(results.get(0).detail());
        }

        @Test
        @DisplayName("Without an issue id every ready issue is assigned")
        void assignAll() {
            h.register("alice", "java");
            h.addIssue(Fixtures.issue("i-2", epic.id(), "java"));

            List<AutoAssignResult> results = service.assign(epic.id(), null);

            assertEquals(2, results.size());
            assertTrue(results.stream().allMatch(r -> r.outcome() == AutoAssignResult.Outcome.ASSIGNED));
        }

        @Test
        @DisplayName("A named agent gets the issue even when another one would score higher")
        void claimForNamedAgent() {
            h.register("alice", "java");
            h.register("bob", "python");

            Assignment assignment = service.claim(epic.id(), "i-1", "bob");

            assertEquals("bob", assignment.agentId());
            assertEquals("bob", h.board.get("i-1").assigneeId());
            assertEquals(1, h.agents.get("bob").activeTasks());
        }

        @Test
        @DisplayName("An issue from another epic cannot be claimed through this one")
        void claimWrongEpic() {
            h.register("alice", "java");
            Epic other = h.activeEpic("Billing");

            assertThrows(IllegalArgumentException.class, () -> service.claim(other.id(), "i-1", "alice"));
            assertEquals(0, h.agents.get("alice").activeTasks());
        }
    }

    @Nested
    @DisplayName("Sync")
    class Sync {

        @Test
        @DisplayName("A changed epic issue refreshes the epic and queued changes are counted")
        void syncRefreshesEpic() {
            Epic epic = service.createEpic("Auth", "", List.of(), List.of(), 7, true);
            when(h.trackerClient.isConfigured()).thenReturn(true);
            when(h.trackerClient.getIssue(eq(7), any())).thenReturn(FetchResult.fresh(
                    new TrackerIssue(7, "Auth v2", "new scope", "open", List.of(), List.of(), Instant.EPOCH),
                    "\"e1\""));
            when(poller.poll(null, epic.id())).thenReturn(List.of(
                    CompletableFuture.completedFuture(true), CompletableFuture.completedFuture(false)));

            SyncResult result = service.syncEpic(epic.id());

            assertTrue(result.epicRefreshed());
            assertEquals(2, result.queued());
            assertEquals(1, result.applied());
            assertEquals("Auth v2", service.getEpic(epic.id()).title());
            assertEquals("new scope", service.getEpic(epic.id()).description());
        }

        @Test
        @DisplayName("An epic without a tracker issue only pulls changes")
        void syncWithoutExternalRef() {
            Epic epic = h.activeEpic("Local");
            when(poller.poll(null, epic.id())).thenReturn(List.of());

            SyncResult result = service.syncEpic(epic.id());

            assertFalse(result.epicRefreshed());
            assertEquals(0, result.queued());
            verify(h.trackerClient, never()).getIssue(anyInt(), any());
        }

        @Test
        @DisplayName("A failed change surfaces as a sync failure")
        void syncFailure() {
            Epic epic = h.activeEpic("Local");
            when(poller.poll(null, epic.id())).thenReturn(List.of(
                    CompletableFuture.failedFuture(new IllegalStateException("boom"))));

            assertThrows(ExternalSyncFailureException.class, () -> service.syncEpic(epic.id()));
        }
    }

    @Test
    @DisplayName("Status counts live epics, agents and open assignments")
    void status() {
        Epic epic = h.activeEpic("Auth");
        h.register("alice", "java");
        h.addIssue(Fixtures.issue("i-1", epic.id(), "java"));
        h.coordinator.claimIssue("alice", "i-1");

        TeammateStatus status = service.status();

        assertFalse(status.enabled());
        assertEquals(1, status.epics());
        assertEquals(1, status.agents());
        assertEquals(1, status.activeAssignments());
        assertFalse(status.trackerConfigured());
    }
}

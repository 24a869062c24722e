package com.teamflow.core.sync;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.WorkRequirements;
import com.teamflow.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class TrackerPollerTest {

    private TrackerSync trackerSync;
    private InboundEventQueue queue;
    private IssueBoard board;
    private TeamflowProperties properties;
    private TrackerPoller poller;

    private final TrackerIssue known = new TrackerIssue(1, "Known", "", "open", List.of(), List.of(),
            Instant.parse("2026-03-01T08:00:00Z"));
    private final TrackerIssue fresh = new TrackerIssue(2, "Fresh", "", "open", List.of(), List.of(),
            Instant.parse("2026-03-01T08:30:00Z"));

    @BeforeEach
    void setUp() {
        trackerSync = mock(TrackerSync.class);
        queue = mock(InboundEventQueue.class);
        board = mock(IssueBoard.class);
        properties = new TeamflowProperties();
        poller = new TrackerPoller(trackerSync, new TrackerEventNormalizer(MutableClock.at("2026-03-01T09:00:00Z")),
                queue, board, properties);
        when(queue.submit(any())).thenReturn(CompletableFuture.completedFuture(true));
        when(board.findByNumber(anyInt())).thenReturn(Optional.empty());
        when(board.findByNumber(1)).thenReturn(Optional.of(
                Issue.open("issue-1", "epic-1", 1, "Known", WorkRequirements.none())));
    }

    @Test
    @DisplayName("Each changed issue is queued as an edit or a creation")
    void queuesChanges() {
        when(trackerSync.listChanged(null)).thenReturn(List.of(known, fresh));

        var futures = poller.poll(null, "epic-1");

        assertEquals(2, futures.size());
        ArgumentCaptor<TrackerEvent> captor = ArgumentCaptor.forClass(TrackerEvent.class);
        verify(queue, times(2)).submit(captor.capture());
        assertEquals(TrackerEvent.Type.EDITED, captor.getAllValues().get(0).type());
        assertEquals(TrackerEvent.Type.CREATED, captor.getAllValues().get(1).type());
        assertEquals("epic-1", captor.getAllValues().get(1).epicHint());
        assertEquals("poll", captor.getAllValues().get(1).source());
    }

    @Test
    @DisplayName("Scheduled polls resume from the newest update seen so far")
    void scheduledPollUsesHighWaterMark() {
        properties.getSync().setPollEnabled(true);
        when(trackerSync.isConfigured()).thenReturn(true);
        when(trackerSync.listChanged(null)).thenReturn(List.of(fresh, known));

        poller.scheduledPoll();
        poller.scheduledPoll();

        verify(trackerSync).listChanged(null);
        verify(trackerSync).listChanged(fresh.updatedAt());
    }

    @Test
    @DisplayName("Scheduled polls do nothing while polling is off or the tracker is unconfigured")
    void scheduledPollDisabled() {
        properties.getSync().setPollEnabled(false);
        when(trackerSync.isConfigured()).thenReturn(true);

        poller.scheduledPoll();

        verify(trackerSync, never()).listChanged(any());
    }
}

package com.teamflow.core.persistence;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.model.Assignment;
import com.teamflow.core.model.AutomatedCheck;
import com.teamflow.core.model.BlockedTaskRecord;
import com.teamflow.core.model.Capability;
import com.teamflow.core.model.CheckType;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicSnapshot;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.model.EscalationStage;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.ManualReview;
import com.teamflow.core.model.Priority;
import com.teamflow.core.model.ReviewDecision;
import com.teamflow.core.model.ReviewRecord;
import com.teamflow.core.model.ScoreBreakdown;
import com.teamflow.core.model.StallReason;
import com.teamflow.core.model.WorkRequirements;
import com.teamflow.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CoordinationRepositoryTest {

    private MutableClock clock;
    private InMemoryContextStore store;
    private CoordinationRepository repository;
    private Epic epic;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T00:00:00Z");
        store = new InMemoryContextStore(clock);
        repository = new CoordinationRepository(store, new TeamflowProperties());
        Instant now = clock.instant();
        epic = new Epic("epic-1", "Auth", "Login", EpicState.ACTIVE, List.of("ship"), List.of("no new deps"),
                42, 3, now, now);
    }

    @Test
    @DisplayName("epics survive a round trip and are indexed")
    void epics() {
        repository.saveEpic(epic);

        assertEquals(epic, repository.loadEpic("epic-1").orElseThrow());
        assertEquals(List.of("epic-1"), repository.epicIds());
    }

    @Test
    @DisplayName("issues keep their typed requirements")
    void issues() {
        var req = new WorkRequirements(Set.of(Capability.of("jwt")), null, Set.of(Capability.language("java")),
                Set.of(Capability.framework("spring")), Set.of(Capability.domain("security")), "feature",
                Priority.HIGH, null, 90, Set.of("issue-1"), List.of("tokens expire"));
        Issue issue = Issue.open("issue-2", "epic-1", 2, "Refresh tokens", req)
                .claimedBy("alice", clock.instant());
        repository.saveIssue(issue);

        assertEquals(List.of(issue), repository.loadIssues("epic-1"));
    }

    @Test
    @DisplayName("assignments, reviews and stall records are stored per epic")
    void records() {
        Instant now = clock.instant();
        var assignment = new Assignment("a-1", "issue-1", "epic-1", "alice", 67.5,
                new ScoreBreakdown(20, 18, 17.5, 5, 7), now, null, null);
        var review = new ReviewRecord("r-1", "issue-1", "bob", "alice",
                List.of(AutomatedCheck.advisoryFailure(CheckType.COVERAGE, "70%")),
                new ManualReview(4, 5, 4.5, List.of(), "ok"), ReviewDecision.APPROVED, "fine", 1, now, now);
        var blocked = new BlockedTaskRecord("issue-1", "epic-1", "alice", Duration.ofMinutes(20),
                StallReason.NO_ACTIVITY, EscalationStage.NOTIFIED, now, now, "asked");

        repository.saveAssignment(assignment);
        repository.saveReview("epic-1", review);
        repository.saveBlocked(blocked);

        assertEquals(List.of(assignment), repository.loadAssignments("epic-1"));
        assertEquals(List.of(review), repository.loadReviews("epic-1"));
        assertEquals(List.of(blocked), repository.loadBlocked("epic-1"));

        repository.deleteBlocked("epic-1", "issue-1");
        assertTrue(repository.loadBlocked("epic-1").isEmpty());
    }

    @Test
    @DisplayName("snapshots can be saved, loaded and cleared")
    void snapshots() {
        var snapshot = new EpicSnapshot(epic, List.of(), List.of(), List.of(), List.of(), "alice", clock.instant());

        repository.saveSnapshot(snapshot);
        assertEquals(snapshot, repository.loadSnapshot("epic-1").orElseThrow());

        assertTrue(repository.deleteSnapshot("epic-1"));
        assertTrue(repository.loadSnapshot("epic-1").isEmpty());
    }

    @Test
    @DisplayName("configured TTL expires records")
    void ttl() {
        var properties = new TeamflowProperties();
        properties.getStore().setDefaultTtl(Duration.ofDays(1));
        var expiring = new CoordinationRepository(store, properties);

        expiring.saveEpic(epic);
        clock.advance(Duration.ofDays(2));

        assertTrue(expiring.loadEpic("epic-1").isEmpty());
    }
}

package com.teamflow.dispatch.cli;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.coordinator.AutoAssignResult;
import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.error.InvalidTransitionException;
import com.teamflow.core.error.NoCapacityException;
import com.teamflow.core.error.NotFoundException;
import com.teamflow.core.health.HealthCheckService;
import com.teamflow.core.health.HealthStatus;
import com.teamflow.core.model.Assignment;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.IssueStatus;
import com.teamflow.core.model.ProgressReport;
import com.teamflow.core.model.ScoreBreakdown;
import com.teamflow.core.model.WorkRequirements;
import com.teamflow.core.progress.ProgressAggregator;
import com.teamflow.core.teammate.ContextSnapshotService;
import com.teamflow.core.teammate.RestoreResult;
import com.teamflow.core.teammate.RestoreStrategy;
import com.teamflow.core.teammate.TeammateService;
import com.teamflow.core.teammate.TeammateStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private TeamflowProperties properties;
    private TeammateService teammateService;
    private ContextSnapshotService snapshots;
    private HealthCheckService healthCheckService;
    private IssueBoard board;
    private ProgressAggregator progress;

    @BeforeEach
    void setUp() {
        properties = new TeamflowProperties();
        teammateService = mock(TeammateService.class);
        snapshots = mock(ContextSnapshotService.class);
        healthCheckService = mock(HealthCheckService.class);
        board = mock(IssueBoard.class);
        progress = mock(ProgressAggregator.class);
    }

    private static Epic epic(String id, EpicState state, long version) {
        return new Epic(id, "Auth rework", "Replace sessions with JWT", state, List.of("ship"), List.of(),
                null, version, NOW, NOW);
    }

    private static ProgressReport report(String epicId) {
        return new ProgressReport(epicId, 4, Map.of(IssueStatus.DONE, 1, IssueStatus.OPEN, 3), 25, 0, 3, 0,
                0.5, List.of(), NOW);
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == EpicCommand.class) {
                    return (K) new EpicCommand(properties);
                }
                if (cls == TeammateCommand.class) {
                    return (K) new TeammateCommand(properties);
                }
                if (cls == EpicCreateCommand.class) {
                    return (K) new EpicCreateCommand(teammateService);
                }
                if (cls == EpicListCommand.class) {
                    return (K) new EpicListCommand(teammateService);
                }
                if (cls == EpicShowCommand.class) {
                    return (K) new EpicShowCommand(teammateService, board, progress);
                }
                if (cls == EpicUpdateCommand.class) {
                    return (K) new EpicUpdateCommand(teammateService);
                }
                if (cls == EpicSyncCommand.class) {
                    return (K) new EpicSyncCommand(teammateService);
                }
                if (cls == EpicAssignCommand.class) {
                    return (K) new EpicAssignCommand(teammateService);
                }
                if (cls == ContextRestoreCommand.class) {
                    return (K) new ContextRestoreCommand(snapshots);
                }
                if (cls == ContextSaveCommand.class) {
                    return (K) new ContextSaveCommand(snapshots);
                }
                if (cls == ContextClearCommand.class) {
                    return (K) new ContextClearCommand(snapshots);
                }
                if (cls == TeammateStatusCommand.class) {
                    return (K) new TeammateStatusCommand(teammateService);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new TeamflowCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every top-level subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String name : List.of("epic", "teammate", "health", "serve", "help")) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "'");
            }
            assertTrue(result.output().contains("--teammate-mode"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Teamflow 0.1.0"));
        }

        @Test
        @DisplayName("epic --help lists epic subcommands")
        void epicHelp() {
            CliResult result = execute("epic", "--help");

            assertEquals(0, result.exitCode());
            for (String name : List.of("create", "list", "show", "update", "sync", "assign")) {
                assertTrue(result.output().contains(name), "Epic help should list '" + name + "'");
            }
        }

        @Test
        @DisplayName("teammate --help lists context commands")
        void teammateHelp() {
            CliResult result = execute("teammate", "--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("context-restore"));
            assertTrue(result.output().contains("context-save"));
            assertTrue(result.output().contains("context-clear"));
        }

        @Test
        @DisplayName("A missing required option is a usage error")
        void missingTitle() {
            CliResult result = execute("--teammate-mode", "epic", "create");

            assertNotEquals(0, result.exitCode());
            assertTrue(result.output().contains("--title"));
            verifyNoInteractions(teammateService);
        }
    }

    @Nested
    @DisplayName("Teammate mode gate")
    class Gate {

        @Test
        @DisplayName("With teammate mode off, commands print enable guidance and exit 0")
        void disabledPrintsGuidance() {
            CliResult result = execute("epic", "list");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Teammate mode is disabled"));
            assertTrue(result.output().contains("teamflow.enabled=true"));
            assertTrue(result.output().contains("TEAMMATE_MODE=true"));
            verifyNoInteractions(teammateService);
        }

        @Test
        @DisplayName("The --teammate-mode flag enables commands for one invocation")
        void flagEnables() {
            when(teammateService.listEpics(null, null)).thenReturn(List.of());

            CliResult result = execute("--teammate-mode", "epic", "list");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No epics found"));
        }

        @Test
        @DisplayName("teamflow.enabled=true enables commands without the flag")
        void configEnables() {
            properties.setEnabled(true);
            when(teammateService.status()).thenReturn(new TeammateStatus(true, 2, 3, 1, false));

            CliResult result = execute("teammate", "status");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Agents:             3"));
            assertTrue(result.output().contains("not configured"));
        }
    }

    @Nested
    @DisplayName("epic commands")
    class EpicCommands {

        @BeforeEach
        void enable() {
            properties.setEnabled(true);
        }

        @Test
        @DisplayName("create passes options through and prints the new id")
        void create() {
            when(teammateService.createEpic(eq("Auth rework"), isNull(), eq(List.of("ship", "test")), eq(List.of()),
                    eq(12), eq(true))).thenReturn(epic("epic-1", EpicState.ACTIVE, 1));

            CliResult result = execute("epic", "create", "--title", "Auth rework", "--objective", "ship",
                    "--objective", "test", "--issue", "12", "--activate");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Created epic epic-1 (ACTIVE)"));
        }

        @Test
        @DisplayName("list prints one line per epic")
        void list() {
            when(teammateService.listEpics(EpicState.ACTIVE, Instant.parse("2026-02-01T00:00:00Z")))
                    .thenReturn(List.of(epic("epic-1", EpicState.ACTIVE, 2), epic("epic-2", EpicState.ACTIVE, 1)));

            CliResult result = execute("epic", "list", "--state", "ACTIVE", "--since", "2026-02-01");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("epic-1"));
            assertTrue(result.output().contains("epic-2"));
        }

        @Test
        @DisplayName("show prints details, issues and progress")
        void show() {
            when(teammateService.getEpic("epic-1")).thenReturn(epic("epic-1", EpicState.ACTIVE, 2));
            when(board.byEpic("epic-1")).thenReturn(List.of(
                    Issue.open("issue-4", "epic-1", 4, "Token refresh", WorkRequirements.none())));
            when(progress.report("epic-1")).thenReturn(report("epic-1"));

            CliResult result = execute("epic", "show", "epic-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Auth rework"));
            assertTrue(result.output().contains("issue-4"));
            assertTrue(result.output().contains("25% of 4 issue(s)"));
        }

        @Test
        @DisplayName("An unknown epic is an error line with exit 1")
        void unknownEpic() {
            when(teammateService.getEpic("epic-x")).thenThrow(new NotFoundException("Unknown epic: epic-x"));

            CliResult result = execute("epic", "show", "epic-x");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Unknown epic: epic-x"));
        }

        @Test
        @DisplayName("update with --state transitions the epic")
        void updateState() {
            when(teammateService.getEpic("epic-1")).thenReturn(epic("epic-1", EpicState.ACTIVE, 2));
            when(teammateService.transitionEpic("epic-1", EpicState.PAUSED, "holiday"))
                    .thenReturn(epic("epic-1", EpicState.PAUSED, 3));

            CliResult result = execute("epic", "update", "epic-1", "--state", "PAUSED", "--reason", "holiday");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("is PAUSED (v3)"));
            verify(teammateService, never()).updateEpic(any(), any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("An illegal transition exits 1")
        void illegalTransition() {
            when(teammateService.getEpic("epic-1")).thenReturn(epic("epic-1", EpicState.ARCHIVED, 5));
            when(teammateService.transitionEpic(any(), any(), any()))
                    .thenThrow(new InvalidTransitionException("epic-1", EpicState.ARCHIVED, EpicState.ACTIVE));

            CliResult result = execute("epic", "update", "epic-1", "--state", "ACTIVE");

            assertEquals(1, result.exitCode());
        }

        @Test
        @DisplayName("update with nothing to change exits 1")
        void updateNothing() {
            CliResult result = execute("epic", "update", "epic-1");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Nothing to update"));
        }

        @Test
        @DisplayName("assign reports each outcome")
        void assign() {
            when(teammateService.assign("epic-1", null)).thenReturn(List.of(
                    new AutoAssignResult("issue-1", AutoAssignResult.Outcome.ASSIGNED, "alice", null),
                    new AutoAssignResult("issue-2", AutoAssignResult.Outcome.NO_CAPACITY, null, "full")));

            CliResult result = execute("epic", "assign", "epic-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("issue-1 -> alice"));
            assertTrue(result.output().contains("issue-2: no agent has capacity"));
        }

        @Test
        @DisplayName("assign --agent hands the issue to that agent")
        void assignToAgent() {
            when(teammateService.claim("epic-1", "issue-3", "bob")).thenReturn(new Assignment("a-1", "issue-3",
                    "epic-1", "bob", 61.0, new ScoreBreakdown(20, 14, 17, 5, 5), NOW, null, null));

            CliResult result = execute("epic", "assign", "epic-1", "--issue", "issue-3", "--agent", "bob");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("issue-3 -> bob"));
            verify(teammateService, never()).assign(any(), any());
        }

        @Test
        @DisplayName("assign --agent without --issue exits 1")
        void assignToAgentWithoutIssue() {
            CliResult result = execute("epic", "assign", "epic-1", "--agent", "bob");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("--agent needs --issue"));
            verifyNoInteractions(teammateService);
        }

        @Test
        @DisplayName("assign --agent on a full agent exits 1")
        void assignToFullAgent() {
            when(teammateService.claim("epic-1", "issue-3", "bob"))
                    .thenThrow(new NoCapacityException("Agent bob has no room (2/2, workload 1.0)"));

            CliResult result = execute("epic", "assign", "epic-1", "-i", "issue-3", "-a", "bob");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("no room"));
        }
    }

    @Nested
    @DisplayName("teammate commands")
    class TeammateCommands {

        @BeforeEach
        void enable() {
            properties.setEnabled(true);
        }

        @Test
        @DisplayName("context-restore parses the strategy and prints counts")
        void restore() {
            when(snapshots.restore("epic-1", RestoreStrategy.SELECTIVE, "alice")).thenReturn(new RestoreResult(
                    epic("epic-1", EpicState.ACTIVE, 4), RestoreStrategy.SELECTIVE, 2, 2, 0, 0, report("epic-1")));

            CliResult result = execute("teammate", "context-restore", "epic-1", "--strategy", "selective",
                    "--agent", "alice");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Restored epic-1 (selective, v4)"));
            assertTrue(result.output().contains("2 issue(s), 2 assignment(s)"));
        }

        @Test
        @DisplayName("An unknown strategy exits 1")
        void badStrategy() {
            CliResult result = execute("teammate", "context-restore", "epic-1", "--strategy", "partial");

            assertEquals(1, result.exitCode());
            verifyNoInteractions(snapshots);
        }
    }

    @Nested
    @DisplayName("health")
    class Health {

        @Test
        @DisplayName("Degraded components still exit 0")
        void degraded() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("context-store", HealthStatus.Status.UP, "Context store available", Map.of()),
                    new HealthStatus("tracker", HealthStatus.Status.DEGRADED, "Issue tracker not configured", Map.of())));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("degraded components"));
        }

        @Test
        @DisplayName("Any DOWN component exits 1")
        void down() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("context-store", HealthStatus.Status.DOWN, "Context store unavailable", Map.of())));

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("one or more components down"));
        }
    }

    @Test
    @DisplayName("Long titles are truncated with an ellipsis")
    void truncate() {
        assertEquals("abcdefg...", ConsoleOutput.truncate("abcdefghijklmnop", 10));
        assertEquals("", ConsoleOutput.truncate(null, 10));
    }
}

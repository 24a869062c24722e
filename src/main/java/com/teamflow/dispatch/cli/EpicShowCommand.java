package com.teamflow.dispatch.cli;

import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.Issue;
import com.teamflow.core.progress.ProgressAggregator;
import com.teamflow.core.teammate.TeammateService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;

/**
 * CLI command: teamflow epic show &lt;epic-id&gt;
 */
@Command(name = "show", mixinStandardHelpOptions = true, description = "Show an epic with its issues and progress")
@Component
public class EpicShowCommand extends TeammateSubcommand {

    @ParentCommand
    EpicCommand parent;

    @Parameters(index = "0", description = "Epic ID")
    String epicId;

    private final TeammateService teammateService;
    private final IssueBoard board;
    private final ProgressAggregator progress;

    public EpicShowCommand(TeammateService teammateService, IssueBoard board, ProgressAggregator progress) {
        this.teammateService = teammateService;
        this.board = board;
        this.progress = progress;
    }

    @Override
    protected TeammateModeGroup group() {
        return parent;
    }

    @Override
    protected int execute() {
        Epic epic = teammateService.getEpic(epicId);
        ConsoleOutput.epicDetail(epic);

        List<Issue> issues = board.byEpic(epicId);
        if (!issues.isEmpty()) {
            System.out.println();
            System.out.printf("  %-12s %-18s %-10s %-14s %s%n", "ISSUE", "STATUS", "PRIORITY", "ASSIGNEE", "TITLE");
            System.out.println("  " + "-".repeat(72));
            for (Issue i : issues) {
                System.out.printf("  %-12s %-18s %-10s %-14s %s%n", i.id(), i.status(), i.priority(),
                        i.assigneeId() == null ? "-" : i.assigneeId(), ConsoleOutput.truncate(i.title(), 30));
            }
        }
        ConsoleOutput.progress(progress.report(epicId));
        return 0;
    }
}

package com.teamflow.dispatch.cli;

import com.teamflow.core.coordinator.AutoAssignResult;
import com.teamflow.core.model.Assignment;
import com.teamflow.core.teammate.TeammateService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;

/**
 * CLI command: teamflow epic assign &lt;epic-id&gt; [--issue issue-43 [--agent alice]]
 * <p>
 * Without {@code --agent} the issues go to the best-scoring agents; with it the named
 * agent claims the one issue given by {@code --issue}.
 */
@Command(name = "assign", mixinStandardHelpOptions = true,
        description = "Assign ready issues of an epic to the best available agents")
@Component
public class EpicAssignCommand extends TeammateSubcommand {

    @ParentCommand
    EpicCommand parent;

    @Parameters(index = "0", description = "Epic ID")
    String epicId;

    @Option(names = {"--issue", "-i"}, description = "Assign only this issue")
    String issueId;

    @Option(names = {"--agent", "-a"}, description = "Give the issue to this agent (requires --issue)")
    String agentId;

    private final TeammateService teammateService;

    public EpicAssignCommand(TeammateService teammateService) {
        this.teammateService = teammateService;
    }

    @Override
    protected TeammateModeGroup group() {
        return parent;
    }

    @Override
    protected int execute() {
        if (agentId != null) {
            if (issueId == null) {
                throw new IllegalArgumentException("--agent needs --issue");
            }
            Assignment assignment = teammateService.claim(epicId, issueId, agentId);
            ConsoleOutput.success(assignment.issueId() + " -> " + assignment.agentId());
            return 0;
        }
        List<AutoAssignResult> results = teammateService.assign(epicId, issueId);
        if (results.isEmpty()) {
            ConsoleOutput.info("No ready issues in " + epicId);
            return 0;
        }
        for (AutoAssignResult r : results) {
            switch (r.outcome()) {
                case ASSIGNED -> ConsoleOutput.success(r.issueId() + " -> " + r.agentId());
                case NO_CAPACITY -> ConsoleOutput.warn(r.issueId() + ": no agent has capacity");
                case CONTENTION -> ConsoleOutput.warn(r.issueId() + ": " + r.detail());
            }
        }
        return 0;
    }
}

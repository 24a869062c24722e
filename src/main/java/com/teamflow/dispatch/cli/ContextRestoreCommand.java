package com.teamflow.dispatch.cli;

import com.teamflow.core.teammate.ContextSnapshotService;
import com.teamflow.core.teammate.RestoreResult;
import com.teamflow.core.teammate.RestoreStrategy;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * CLI command: teamflow teammate context-restore &lt;epic-id&gt; [--strategy full|summary|selective]
 */
@Command(name = "context-restore", mixinStandardHelpOptions = true, description = "Restore an epic's saved context")
@Component
public class ContextRestoreCommand extends TeammateSubcommand {

    @ParentCommand
    TeammateCommand parent;

    @Parameters(index = "0", description = "Epic ID")
    String epicId;

    @Option(names = {"--strategy", "-s"}, defaultValue = "full",
            description = "full, summary or selective (default: ${DEFAULT-VALUE})")
    String strategy;

    @Option(names = {"--agent", "-a"}, description = "Agent whose issues a selective restore loads")
    String agentId;

    private final ContextSnapshotService snapshots;

    public ContextRestoreCommand(ContextSnapshotService snapshots) {
        this.snapshots = snapshots;
    }

    @Override
    protected TeammateModeGroup group() {
        return parent;
    }

    @Override
    protected int execute() {
        RestoreResult result = snapshots.restore(epicId, RestoreStrategy.parse(strategy), agentId);
        ConsoleOutput.success("Restored " + epicId + " (" + result.strategy().name().toLowerCase()
                + ", v" + result.epic().version() + ")");
        if (result.strategy() != RestoreStrategy.SUMMARY) {
            ConsoleOutput.info(result.issues() + " issue(s), " + result.assignments() + " assignment(s), "
                    + result.reviews() + " review(s), " + result.blocked() + " stall record(s)");
        }
        ConsoleOutput.progress(result.progress());
        return 0;
    }
}

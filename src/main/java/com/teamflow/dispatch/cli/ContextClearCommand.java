package com.teamflow.dispatch.cli;

import com.teamflow.core.teammate.ContextSnapshotService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * CLI command: teamflow teammate context-clear &lt;epic-id&gt;
 */
@Command(name = "context-clear", mixinStandardHelpOptions = true, description = "Delete an epic's saved context")
@Component
public class ContextClearCommand extends TeammateSubcommand {

    @ParentCommand
    TeammateCommand parent;

    @Parameters(index = "0", description = "Epic ID")
    String epicId;

    private final ContextSnapshotService snapshots;

    public ContextClearCommand(ContextSnapshotService snapshots) {
        this.snapshots = snapshots;
    }

    @Override
    protected TeammateModeGroup group() {
        return parent;
    }

    @Override
    protected int execute() {
        if (snapshots.clear(epicId)) {
            ConsoleOutput.success("Cleared saved context of " + epicId);
        } else {
            ConsoleOutput.info("No saved context for " + epicId);
        }
        return 0;
    }
}

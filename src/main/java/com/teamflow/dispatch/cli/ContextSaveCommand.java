package com.teamflow.dispatch.cli;

import com.teamflow.core.model.EpicSnapshot;
import com.teamflow.core.teammate.ContextSnapshotService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * CLI command: teamflow teammate context-save &lt;epic-id&gt; [--agent id]
 */
@Command(name = "context-save", mixinStandardHelpOptions = true, description = "Save an epic's context")
@Component
public class ContextSaveCommand extends TeammateSubcommand {

    @ParentCommand
    TeammateCommand parent;

    @Parameters(index = "0", description = "Epic ID")
    String epicId;

    @Option(names = {"--agent", "-a"}, description = "Agent saving the context")
    String agentId;

    private final ContextSnapshotService snapshots;

    public ContextSaveCommand(ContextSnapshotService snapshots) {
        this.snapshots = snapshots;
    }

    @Override
    protected TeammateModeGroup group() {
        return parent;
    }

    @Override
    protected int execute() {
        EpicSnapshot snapshot = snapshots.save(epicId, agentId);
        ConsoleOutput.success("Saved " + epicId + " (v" + snapshot.epic().version() + "): "
                + snapshot.issues().size() + " issue(s), " + snapshot.assignments().size() + " assignment(s), "
                + snapshot.reviews().size() + " review(s)");
        return 0;
    }
}

package com.teamflow.dispatch.cli;

import com.teamflow.core.teammate.SyncResult;
import com.teamflow.core.teammate.TeammateService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * CLI command: teamflow epic sync &lt;epic-id&gt;
 */
@Command(name = "sync", mixinStandardHelpOptions = true, description = "Pull issue tracker changes into an epic")
@Component
public class EpicSyncCommand extends TeammateSubcommand {

    @ParentCommand
    EpicCommand parent;

    @Parameters(index = "0", description = "Epic ID")
    String epicId;

    private final TeammateService teammateService;

    public EpicSyncCommand(TeammateService teammateService) {
        this.teammateService = teammateService;
    }

    @Override
    protected TeammateModeGroup group() {
        return parent;
    }

    @Override
    protected int execute() {
        if (!teammateService.status().trackerConfigured()) {
            ConsoleOutput.warn("Issue tracker not configured (teamflow.sync.owner / teamflow.sync.repo); nothing to sync");
            return 0;
        }
        SyncResult result = teammateService.syncEpic(epicId);
        if (result.epicRefreshed()) {
            ConsoleOutput.info("Epic details refreshed from the tracker");
        }
        ConsoleOutput.success("Synced " + epicId + ": " + result.applied() + " of " + result.queued()
                + " change(s) applied");
        return 0;
    }
}

package com.teamflow.dispatch.cli;

import com.teamflow.core.config.TeamflowProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

/**
 * CLI command group: teamflow epic ...
 */
@Command(name = "epic", mixinStandardHelpOptions = true, description = "Create and manage epics",
        subcommands = {
                EpicCreateCommand.class,
                EpicListCommand.class,
                EpicShowCommand.class,
                EpicUpdateCommand.class,
                EpicSyncCommand.class,
                EpicAssignCommand.class
        })
@Component
public class EpicCommand implements Runnable, TeammateModeGroup {

    @ParentCommand
    TeamflowCommand root;

    private final TeamflowProperties properties;

    public EpicCommand(TeamflowProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Override
    public boolean teammateModeEnabled() {
        return properties.isEnabled() || (root != null && root.isTeammateMode());
    }
}

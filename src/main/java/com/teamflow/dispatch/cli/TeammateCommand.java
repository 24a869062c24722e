package com.teamflow.dispatch.cli;

import com.teamflow.core.config.TeamflowProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

/**
 * CLI command group: teamflow teammate ...
 */
@Command(name = "teammate", mixinStandardHelpOptions = true,
        description = "Save, restore and inspect teammate context",
        subcommands = {
                ContextRestoreCommand.class,
                ContextSaveCommand.class,
                ContextClearCommand.class,
                TeammateStatusCommand.class
        })
@Component
public class TeammateCommand implements Runnable, TeammateModeGroup {

    @ParentCommand
    TeamflowCommand root;

    private final TeamflowProperties properties;

    public TeammateCommand(TeamflowProperties properties) {
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

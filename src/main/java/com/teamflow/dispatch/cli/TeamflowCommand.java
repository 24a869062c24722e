package com.teamflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Top-level CLI command for Teamflow.
 * Routes to subcommands: epic, teammate, health, serve.
 */
@Command(
        name = "teamflow",
        mixinStandardHelpOptions = true,
        version = "Teamflow 0.1.0",
        description = "Coordinates autonomous worker agents across epics and issues",
        subcommands = {
                EpicCommand.class,
                TeammateCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TeamflowCommand implements Runnable {

    @Option(names = "--teammate-mode", description = "Enable teammate mode for this invocation")
    boolean teammateMode;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }

    public boolean isTeammateMode() {
        return teammateMode;
    }
}

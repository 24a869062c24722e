package com.teamflow.dispatch.cli;

import com.teamflow.core.teammate.TeammateService;
import com.teamflow.core.teammate.TeammateStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

/**
 * CLI command: teamflow teammate status
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show teammate mode status")
@Component
public class TeammateStatusCommand extends TeammateSubcommand {

    @ParentCommand
    TeammateCommand parent;

    private final TeammateService teammateService;

    public TeammateStatusCommand(TeammateService teammateService) {
        this.teammateService = teammateService;
    }

    @Override
    protected TeammateModeGroup group() {
        return parent;
    }

    @Override
    protected int execute() {
        TeammateStatus status = teammateService.status();
        ConsoleOutput.success("Teammate mode enabled");
        System.out.println("  Epics:              " + status.epics());
        System.out.println("  Agents:             " + status.agents());
        System.out.println("  Active assignments: " + status.activeAssignments());
        if (status.trackerConfigured()) {
            ConsoleOutput.success("Issue tracker configured");
        } else {
            ConsoleOutput.warn("Issue tracker not configured; running on local state only");
        }
        return 0;
    }
}

package com.teamflow.dispatch.cli;

import com.teamflow.core.model.Epic;
import com.teamflow.core.teammate.TeammateService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: teamflow epic create --title ...
 */
@Command(name = "create", mixinStandardHelpOptions = true, description = "Create an epic")
@Component
public class EpicCreateCommand extends TeammateSubcommand {

    @ParentCommand
    EpicCommand parent;

    @Option(names = {"--title", "-t"}, required = true, description = "Epic title")
    String title;

    @Option(names = {"--description", "-d"}, description = "Epic description")
    String description;

    @Option(names = "--objective", description = "Objective (repeatable)")
    List<String> objectives = new ArrayList<>();

    @Option(names = "--constraint", description = "Constraint (repeatable)")
    List<String> constraints = new ArrayList<>();

    @Option(names = "--issue", description = "Tracker issue number that represents the epic")
    Integer externalRef;

    @Option(names = "--activate", description = "Move the epic to ACTIVE right away")
    boolean activate;

    private final TeammateService teammateService;

    public EpicCreateCommand(TeammateService teammateService) {
        this.teammateService = teammateService;
    }

    @Override
    protected TeammateModeGroup group() {
        return parent;
    }

    @Override
    protected int execute() {
        Epic epic = teammateService.createEpic(title, description, objectives, constraints, externalRef, activate);
        ConsoleOutput.success("Created epic " + epic.id() + " (" + epic.state() + ")");
        return 0;
    }
}

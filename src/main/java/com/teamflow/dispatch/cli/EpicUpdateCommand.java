package com.teamflow.dispatch.cli;

import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.teammate.TeammateService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;

/**
 * CLI command: teamflow epic update &lt;epic-id&gt; [--title ..] [--state PAUSED]
 */
@Command(name = "update", mixinStandardHelpOptions = true,
        description = "Update an epic's details and/or move it to another state")
@Component
public class EpicUpdateCommand extends TeammateSubcommand {

    @ParentCommand
    EpicCommand parent;

    @Parameters(index = "0", description = "Epic ID")
    String epicId;

    @Option(names = {"--title", "-t"}, description = "New title")
    String title;

    @Option(names = {"--description", "-d"}, description = "New description")
    String description;

    @Option(names = "--objective", description = "Replace objectives (repeatable)")
    List<String> objectives;

    @Option(names = "--constraint", description = "Replace constraints (repeatable)")
    List<String> constraints;

    @Option(names = "--expected-version", description = "Fail if the epic is no longer at this version")
    Long expectedVersion;

    @Option(names = "--state", description = "Target state: ${COMPLETION-CANDIDATES}")
    EpicState state;

    @Option(names = "--reason", description = "Reason recorded with the state change")
    String reason;

    private final TeammateService teammateService;

    public EpicUpdateCommand(TeammateService teammateService) {
        this.teammateService = teammateService;
    }

    @Override
    protected TeammateModeGroup group() {
        return parent;
    }

    @Override
    protected int execute() {
        boolean detailsChanged = title != null || description != null || objectives != null
                || constraints != null;
        if (!detailsChanged && state == null) {
            throw new IllegalArgumentException("Nothing to update: pass at least one field or --state");
        }
        Epic epic = teammateService.getEpic(epicId);
        if (detailsChanged) {
            epic = teammateService.updateEpic(epicId, title, description, objectives, constraints, expectedVersion);
        }
        if (state != null) {
            epic = teammateService.transitionEpic(epicId, state, reason);
        }
        ConsoleOutput.success("Epic " + epic.id() + " is " + epic.state() + " (v" + epic.version() + ")");
        return 0;
    }
}

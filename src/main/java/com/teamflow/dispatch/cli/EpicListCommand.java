package com.teamflow.dispatch.cli;

import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.teammate.TeammateService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * CLI command: teamflow epic list [--state ACTIVE] [--since 2024-01-31]
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List epics, newest first")
@Component
public class EpicListCommand extends TeammateSubcommand {

    @ParentCommand
    EpicCommand parent;

    @Option(names = {"--state", "-s"}, description = "Only epics in this state: ${COMPLETION-CANDIDATES}")
    EpicState state;

    @Option(names = "--since", description = "Only epics created after this date (yyyy-MM-dd) or instant")
    String since;

    private final TeammateService teammateService;

    public EpicListCommand(TeammateService teammateService) {
        this.teammateService = teammateService;
    }

    @Override
    protected TeammateModeGroup group() {
        return parent;
    }

    @Override
    protected int execute() {
        List<Epic> epics = teammateService.listEpics(state, parseSince(since));
        if (epics.isEmpty()) {
            ConsoleOutput.info("No epics found");
            return 0;
        }
        System.out.printf("  %-32s %-14s %-5s %s%n", "EPIC", "STATE", "VER", "TITLE");
        System.out.println("  " + "-".repeat(72));
        epics.forEach(ConsoleOutput::epicLine);
        return 0;
    }

    static Instant parseSince(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return value.contains("T") ? Instant.parse(value)
                    : LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid --since value: " + value);
        }
    }
}

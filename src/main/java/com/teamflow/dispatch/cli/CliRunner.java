package com.teamflow.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TeamflowCommand teamflowCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TeamflowCommand teamflowCommand, IFactory factory) {
        this.teamflowCommand = teamflowCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // In serve mode the embedded web server keeps the JVM alive; picocli would return at once.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(teamflowCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

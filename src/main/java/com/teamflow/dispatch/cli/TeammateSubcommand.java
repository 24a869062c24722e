package com.teamflow.dispatch.cli;

import com.teamflow.core.error.CoordinationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Base for {@code epic} and {@code teammate} subcommands.
 * <p>
 * Prints enable guidance and exits 0 when teammate mode is off. Coordination and
 * argument errors become a red error line and exit code 1.
 */
public abstract class TeammateSubcommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TeammateSubcommand.class);

    protected abstract TeammateModeGroup group();

    protected abstract int execute();

    @Override
    public Integer call() {
        if (group() == null || !group().teammateModeEnabled()) {
            printEnableGuidance();
            return 0;
        }
        try {
            return execute();
        } catch (CoordinationException | IllegalArgumentException | IllegalStateException e) {
            log.debug("Command failed", e);
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    static void printEnableGuidance() {
        ConsoleOutput.info("Teammate mode is disabled. Enable it with one of:");
        System.out.println("  config:      teamflow.enabled=true");
        System.out.println("  flag:        teamflow --teammate-mode <command>");
        System.out.println("  environment: TEAMMATE_MODE=true");
    }
}

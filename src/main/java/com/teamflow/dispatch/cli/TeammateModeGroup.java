package com.teamflow.dispatch.cli;

/**
 * A command group whose subcommands only act when teammate mode is enabled.
 */
public interface TeammateModeGroup {

    boolean teammateModeEnabled();
}

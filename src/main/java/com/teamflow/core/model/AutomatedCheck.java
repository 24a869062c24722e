package com.teamflow.core.model;

import java.io.Serializable;

/**
 * Result of an automated check run by an external CI collaborator.
 *
 * @param type     kind of check
 * @param passed   whether the check passed
 * @param blocking whether a failure of this check must block approval
 * @param detail   free-form detail, nullable
 */
public record AutomatedCheck(
    CheckType type,
    boolean passed,
    boolean blocking,
    String detail
) implements Serializable {

    public static AutomatedCheck pass(CheckType type) {
        return new AutomatedCheck(type, true, true, null);
    }

    public static AutomatedCheck blockingFailure(CheckType type, String detail) {
        return new AutomatedCheck(type, false, true, detail);
    }

    public static AutomatedCheck advisoryFailure(CheckType type, String detail) {
        return new AutomatedCheck(type, false, false, detail);
    }

    public boolean isBlockingFailure() {
        return !passed && blocking;
    }
}

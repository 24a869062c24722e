package com.teamflow.core.model;

/**
 * Named rungs of the escalation ladder.
 * <p>
 * The only way to move is {@link #next()}, one rung at a time, so a record can
 * never skip a level or go back down. ESCALATED_TO_HUMAN is the last rung.
 */
public enum EscalationStage {
    DETECTED(0),
    NOTIFIED(1),
    AUTO_RECOVERY_ATTEMPTED(2),
    REASSIGNED(3),
    ESCALATED_TO_HUMAN(4);

    private final int level;

    EscalationStage(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public boolean isFinal() {
        return this == ESCALATED_TO_HUMAN;
    }

    public EscalationStage next() {
        return switch (this) {
            case DETECTED -> NOTIFIED;
            case NOTIFIED -> AUTO_RECOVERY_ATTEMPTED;
            case AUTO_RECOVERY_ATTEMPTED -> REASSIGNED;
            case REASSIGNED, ESCALATED_TO_HUMAN -> ESCALATED_TO_HUMAN;
        };
    }
}

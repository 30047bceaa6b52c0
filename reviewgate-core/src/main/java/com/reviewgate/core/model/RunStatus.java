package com.reviewgate.core.model;

/**
 * Lifecycle states for a pipeline run.
 */
public enum RunStatus {
    /**
     * Run recorded at trigger time, not yet picked up by the engine.
     * Transitions: -> RUNNING, CANCELLED, FAILED
     */
    CREATED,

    /**
     * Engine is walking the stages.
     * Transitions: -> SUSPENDED, ADMITTED, BLOCKED, CANCELLED, FAILED
     */
    RUNNING,

    /**
     * At least one task is waiting for an external signal. No owner.
     * Transitions: -> RUNNING, CANCELLED, FAILED (fatal error on resume)
     */
    SUSPENDED,

    /**
     * Decision rendered: change admitted. Terminal state.
     */
    ADMITTED,

    /**
     * Decision rendered: change blocked. Terminal state.
     */
    BLOCKED,

    /**
     * Cancelled by request or superseded by a newer run. Terminal state.
     */
    CANCELLED,

    /**
     * Fatal engine error. Terminal state.
     */
    FAILED;

    public boolean isTerminal() {
        return this == ADMITTED || this == BLOCKED || this == CANCELLED || this == FAILED;
    }

    /**
     * Terminal states that trigger compensation.
     */
    public boolean requiresCompensation() {
        return this == BLOCKED || this == FAILED;
    }

    public boolean canTransitionTo(RunStatus target) {
        return switch (this) {
            case CREATED -> target == RUNNING || target == CANCELLED || target == FAILED;
            case RUNNING -> target == SUSPENDED || target == ADMITTED || target == BLOCKED ||
                           target == CANCELLED || target == FAILED;
            case SUSPENDED -> target == RUNNING || target == CANCELLED || target == FAILED;
            case ADMITTED, BLOCKED, CANCELLED, FAILED -> false;
        };
    }
}

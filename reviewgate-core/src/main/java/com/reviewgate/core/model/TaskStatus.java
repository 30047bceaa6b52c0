package com.reviewgate.core.model;

/**
 * Recorded outcome of a task.
 */
public enum TaskStatus {
    SUCCESS,
    FAILURE,
    /**
     * The invocation, or a suspension wait, exceeded its deadline.
     */
    TIMEOUT,
    /**
     * The stage or task condition evaluated false.
     */
    SKIPPED;

    /**
     * FAILURE and TIMEOUT both count as a failed task.
     */
    public boolean isFailure() {
        return this == FAILURE || this == TIMEOUT;
    }
}

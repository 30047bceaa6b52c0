package com.reviewgate.engine.events;

/**
 * Structured events emitted while a run progresses.
 */
public enum RunEventType {
    // Run lifecycle
    RUN_CREATED,
    RUN_STARTED,
    RUN_RESUMED,
    RUN_SUSPENDED,
    RUN_DECIDED,
    RUN_CANCELLED,
    RUN_SUPERSEDED,
    RUN_FAILED,

    // Stages
    STAGE_STARTED,
    STAGE_SKIPPED,
    STAGE_COMPLETED,

    // Tasks
    TASK_STARTED,
    TASK_COMPLETED,
    TASK_RETRIED,
    TASK_SKIPPED,
    TASK_TIMED_OUT,
    TASK_SUSPENDED,

    // Compensation
    COMPENSATION_EXECUTED,
    COMPENSATION_FAILED,

    // Reconciliation
    SLA_BREACHED
}

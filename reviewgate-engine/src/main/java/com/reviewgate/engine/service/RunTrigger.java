package com.reviewgate.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.reviewgate.core.model.RunContext;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.model.Severity;
import com.reviewgate.core.model.TaskStatus;

/**
 * Entry point for callers that start and steer review runs.
 */
public interface RunTrigger {

    /**
     * Create a run and schedule its execution. An older active run of the same
     * pipeline for the same subject is cancelled as superseded.
     *
     * @param definitionRef {@code name} (latest version) or {@code name:version}
     * @param context The change under review
     * @return The new run ID
     * @throws com.reviewgate.core.exception.NotFoundException if no such pipeline is registered
     * @throws com.reviewgate.core.exception.DefinitionValidationException if the pipeline is invalid
     */
    String createRun(String definitionRef, RunContext context);

    /**
     * Get a run by ID.
     *
     * @param runId The run ID
     * @return The run state
     * @throws com.reviewgate.core.exception.NotFoundException if the run does not exist
     */
    RunState getRun(String runId);

    /**
     * Cancel a run. Unowned and suspended runs are cancelled directly; a run
     * being executed is flagged and stops at its next wave boundary.
     * Cancelling an already cancelled run is a no-op.
     *
     * @param runId The run ID
     * @param reason The cancellation reason
     * @return The run state after the request was recorded
     * @throws com.reviewgate.core.exception.InvalidStateTransitionException if the run already finished otherwise
     */
    RunState cancelRun(String runId, String reason);

    /**
     * Deliver the result of a suspended task. A signal for a task that already
     * has a result is ignored.
     *
     * @param runId The run ID
     * @param signal The task's result
     * @return The run state after the signal was recorded
     * @throws com.reviewgate.core.exception.NotFoundException if the task is not awaiting a signal
     * @throws com.reviewgate.core.exception.InvalidStateTransitionException if the run is terminal
     */
    RunState resumeSignal(String runId, ResumeSignal signal);

    /**
     * Late result of a suspended task.
     */
    record ResumeSignal(
        String taskId,
        TaskStatus status,
        Severity severity,
        JsonNode payload
    ) {}
}

package com.reviewgate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Recorded outcome of one task in one run. Recorded at most once per run.
 *
 * Idempotency key: {@code runId:taskId:attempt}.
 */
public record TaskResult(
    String taskId,
    TaskStatus status,
    Severity severity,
    JsonNode payload,
    Instant startedAt,
    Instant completedAt,
    int attempt,
    int retryCount,
    String idempotencyKey,
    String errorCode,
    String message
) {
    public TaskResult {
        severity = severity != null ? severity : Severity.NONE;
    }

    public static String idempotencyKey(String runId, String taskId, int attempt) {
        return runId + ":" + taskId + ":" + attempt;
    }

    /**
     * Result for a task whose stage or own condition evaluated false.
     */
    public static TaskResult skipped(String runId, String taskId, String reason, Instant at) {
        return new TaskResult(
            taskId, TaskStatus.SKIPPED, Severity.NONE, null, at, at,
            0, 0, idempotencyKey(runId, taskId, 0), null, reason
        );
    }

    /**
     * Result for a suspended task whose wait deadline passed.
     */
    public static TaskResult waitExpired(String runId, PendingTask pending, Instant at) {
        return new TaskResult(
            pending.taskId(), TaskStatus.TIMEOUT, Severity.NONE, null,
            pending.suspendedAt(), at, pending.attempt(), pending.attempt() - 1,
            idempotencyKey(runId, pending.taskId(), pending.attempt()),
            "WAIT_TIMEOUT", "No signal received before " + pending.waitDeadline()
        );
    }

    public boolean counted() {
        return status != TaskStatus.SKIPPED;
    }
}

package com.reviewgate.core.model;

import java.time.Instant;

/**
 * A task that answered "suspended" and waits for an external signal.
 */
public record PendingTask(
    String taskId,
    int attempt,
    String idempotencyKey,
    Instant suspendedAt,
    Instant waitDeadline
) {
    public boolean isExpired(Instant now) {
        return waitDeadline != null && !now.isBefore(waitDeadline);
    }
}

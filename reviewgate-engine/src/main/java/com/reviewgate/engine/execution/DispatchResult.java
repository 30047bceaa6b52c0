package com.reviewgate.engine.execution;

import com.reviewgate.core.model.PendingTask;
import com.reviewgate.core.model.TaskResult;

/**
 * Outcome of dispatching one task: a recorded result, or a suspension.
 */
public record DispatchResult(
    String taskId,
    TaskResult result,
    PendingTask pending
) {
    public static DispatchResult completed(TaskResult result) {
        return new DispatchResult(result.taskId(), result, null);
    }

    public static DispatchResult suspended(PendingTask pending) {
        return new DispatchResult(pending.taskId(), null, pending);
    }

    public boolean isSuspended() {
        return pending != null;
    }
}

package com.reviewgate.worker;

import com.reviewgate.core.exception.TaskInvocationException;
import com.reviewgate.core.invocation.TaskOutcome;

/**
 * In-process implementation of a task reference.
 * Handlers are registered on a {@link LocalTaskInvoker} under a task reference.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Execute the task.
     *
     * @param context Invocation context providing input and utilities
     * @return The task's answer
     * @throws TaskInvocationException if the task cannot complete
     */
    TaskOutcome handle(TaskContext context) throws TaskInvocationException;
}

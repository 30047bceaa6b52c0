package com.reviewgate.core.invocation;

import com.reviewgate.core.exception.TaskInvocationException;

/**
 * Invokes one remote task. Stateless and unaware of pipeline structure;
 * timeouts and retries are applied by the caller.
 */
@FunctionalInterface
public interface TaskInvoker {

    /**
     * Invoke the task.
     *
     * @param invocation The call to make
     * @return The task's answer
     * @throws TaskInvocationException on transport or infrastructure failure
     */
    TaskOutcome invoke(TaskInvocation invocation) throws TaskInvocationException;
}

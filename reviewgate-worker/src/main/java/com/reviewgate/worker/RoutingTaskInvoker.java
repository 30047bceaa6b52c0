package com.reviewgate.worker;

import com.reviewgate.core.exception.TaskInvocationException;
import com.reviewgate.core.invocation.TaskInvocation;
import com.reviewgate.core.invocation.TaskInvoker;
import com.reviewgate.core.invocation.TaskOutcome;

/**
 * Sends a task to its in-process handler when one is registered, otherwise to its HTTP endpoint.
 */
public class RoutingTaskInvoker implements TaskInvoker {

    private final LocalTaskInvoker local;
    private final HttpTaskInvoker remote;

    public RoutingTaskInvoker(LocalTaskInvoker local, HttpTaskInvoker remote) {
        this.local = local;
        this.remote = remote;
    }

    @Override
    public TaskOutcome invoke(TaskInvocation invocation) throws TaskInvocationException {
        if (local.handles(invocation.taskRef())) {
            return local.invoke(invocation);
        }
        return remote.invoke(invocation);
    }
}

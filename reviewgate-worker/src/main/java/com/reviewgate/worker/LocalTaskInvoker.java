package com.reviewgate.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reviewgate.core.exception.TaskInvocationException;
import com.reviewgate.core.invocation.TaskInvocation;
import com.reviewgate.core.invocation.TaskInvoker;
import com.reviewgate.core.invocation.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Invokes tasks implemented in this process, looked up by task reference.
 *
 * Usage:
 * <pre>
 * LocalTaskInvoker invoker = new LocalTaskInvoker(objectMapper);
 * invoker.register("code-quality", context -> {
 *     JsonNode diff = context.getPayload().path("attributes").path("diff");
 *     return TaskOutcome.success(Severity.LOW, context.toJsonNode(Map.of("checked", true)));
 * });
 * </pre>
 */
public class LocalTaskInvoker implements TaskInvoker {

    private static final Logger log = LoggerFactory.getLogger(LocalTaskInvoker.class);

    public static final String UNKNOWN_TASK_REF = "UNKNOWN_TASK_REF";
    public static final String NO_OUTCOME = "NO_OUTCOME";

    private final ObjectMapper objectMapper;
    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    public LocalTaskInvoker(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Register a handler. A later registration for the same reference replaces the earlier one.
     */
    public LocalTaskInvoker register(String taskRef, TaskHandler handler) {
        if (handlers.put(taskRef, handler) != null) {
            log.warn("Replaced task handler for {}", taskRef);
        } else {
            log.info("Registered task handler: {}", taskRef);
        }
        return this;
    }

    public boolean handles(String taskRef) {
        return handlers.containsKey(taskRef);
    }

    public Set<String> taskRefs() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public TaskOutcome invoke(TaskInvocation invocation) throws TaskInvocationException {
        TaskHandler handler = handlers.get(invocation.taskRef());
        if (handler == null) {
            throw TaskInvocationException.permanent(UNKNOWN_TASK_REF,
                "No handler registered for task reference " + invocation.taskRef());
        }

        log.debug("Executing {} for task {} (attempt {})",
            invocation.taskRef(), invocation.taskId(), invocation.attempt());
        TaskOutcome outcome = handler.handle(new TaskContext(invocation, objectMapper));
        if (outcome == null) {
            throw TaskInvocationException.permanent(NO_OUTCOME,
                "Handler for " + invocation.taskRef() + " returned no outcome");
        }
        return outcome;
    }
}

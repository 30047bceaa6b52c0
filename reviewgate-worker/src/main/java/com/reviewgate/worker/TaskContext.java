package com.reviewgate.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.reviewgate.core.invocation.TaskInvocation;

import java.time.Duration;

/**
 * Context provided to task handlers during execution.
 */
public class TaskContext {

    private final TaskInvocation invocation;
    private final ObjectMapper objectMapper;

    public TaskContext(TaskInvocation invocation, ObjectMapper objectMapper) {
        this.invocation = invocation;
        this.objectMapper = objectMapper;
    }

    public TaskInvocation getInvocation() {
        return invocation;
    }

    /**
     * Get the invocation payload: run context, parameters and earlier results.
     */
    public JsonNode getPayload() {
        return invocation.payload() != null ? invocation.payload() : NullNode.getInstance();
    }

    /**
     * Get the payload as a specific type.
     */
    public <T> T getPayload(Class<T> type) {
        return objectMapper.convertValue(getPayload(), type);
    }

    /**
     * Get the task's static parameters, or a missing node when it declares none.
     */
    public JsonNode getParameters() {
        return getPayload().path("parameters");
    }

    public String getRunId() {
        return invocation.runId();
    }

    public String getTaskId() {
        return invocation.taskId();
    }

    public String getTaskRef() {
        return invocation.taskRef();
    }

    public int getAttempt() {
        return invocation.attempt();
    }

    /**
     * Get the idempotency key for this attempt.
     * Pass it along on external calls so a repeated attempt is deduplicated.
     */
    public String getIdempotencyKey() {
        return invocation.idempotencyKey();
    }

    public Duration getTimeout() {
        return invocation.timeout();
    }

    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }
}

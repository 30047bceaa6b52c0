package com.reviewgate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.List;

/**
 * Definition of a task within a stage.
 * Describes what to invoke, not run-specific data.
 *
 * Invariants:
 * - id is non-empty and unique within the pipeline
 * - timeout, when set, is positive
 * - dependsOn only names tasks of the same or an earlier stage
 */
public record TaskSpec(
    String id,
    String taskRef,
    Duration timeout,
    Integer retries,
    Condition condition,
    List<String> dependsOn,
    boolean required,
    JsonNode parameters,
    Duration waitTimeout,
    String description
) {
    public TaskSpec {
        taskRef = taskRef != null ? taskRef : id;
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    /**
     * Get the effective invocation timeout (task-specific or pipeline default).
     */
    public Duration effectiveTimeout(PipelineDefaults defaults) {
        return timeout != null ? timeout : defaults.taskTimeout();
    }

    /**
     * Get the effective retry policy. A task-level retry count overrides the
     * number of attempts of the pipeline default policy.
     */
    public RetryPolicy effectiveRetryPolicy(PipelineDefaults defaults) {
        RetryPolicy base = defaults.retryPolicy();
        return retries != null ? base.withRetries(retries) : base;
    }

    /**
     * Get the effective suspension wait timeout.
     */
    public Duration effectiveWaitTimeout(PipelineDefaults defaults) {
        return waitTimeout != null ? waitTimeout : defaults.waitTimeout();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String taskRef;
        private Duration timeout;
        private Integer retries;
        private Condition condition;
        private List<String> dependsOn = List.of();
        private boolean required;
        private JsonNode parameters;
        private Duration waitTimeout;
        private String description;

        private Builder(String id) {
            this.id = id;
            this.taskRef = id;
        }

        public Builder taskRef(String taskRef) {
            this.taskRef = taskRef;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retries(Integer retries) {
            this.retries = retries;
            return this;
        }

        public Builder condition(Condition condition) {
            this.condition = condition;
            return this;
        }

        public Builder dependsOn(String... taskIds) {
            this.dependsOn = List.of(taskIds);
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder parameters(JsonNode parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder waitTimeout(Duration waitTimeout) {
            this.waitTimeout = waitTimeout;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public TaskSpec build() {
            return new TaskSpec(id, taskRef, timeout, retries, condition, dependsOn,
                required, parameters, waitTimeout, description);
        }
    }
}

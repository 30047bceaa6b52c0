package com.reviewgate.engine.events;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable record of something that happened to a run.
 * Fanned out to listeners; never persisted by the engine.
 */
public record RunEvent(
    RunEventType type,
    String runId,
    String definitionRef,
    String stageId,
    String taskId,
    Map<String, String> attributes,
    Instant timestamp
) {
    public RunEvent {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static Builder builder(RunEventType type, String runId, Instant timestamp) {
        return new Builder(type, runId, timestamp);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public static class Builder {
        private final RunEventType type;
        private final String runId;
        private final Instant timestamp;
        private String definitionRef;
        private String stageId;
        private String taskId;
        private final Map<String, String> attributes = new LinkedHashMap<>();

        private Builder(RunEventType type, String runId, Instant timestamp) {
            this.type = type;
            this.runId = runId;
            this.timestamp = timestamp;
        }

        public Builder definition(String definitionRef) {
            this.definitionRef = definitionRef;
            return this;
        }

        public Builder stage(String stageId) {
            this.stageId = stageId;
            return this;
        }

        public Builder task(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder attr(String key, Object value) {
            if (value != null) {
                this.attributes.put(key, String.valueOf(value));
            }
            return this;
        }

        public RunEvent build() {
            return new RunEvent(type, runId, definitionRef, stageId, taskId, attributes, timestamp);
        }
    }
}

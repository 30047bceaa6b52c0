package com.reviewgate.core.invocation;

import com.fasterxml.jackson.databind.JsonNode;
import com.reviewgate.core.model.Severity;
import com.reviewgate.core.model.TaskStatus;

/**
 * What a task answered. Only status and severity are interpreted; the payload
 * is opaque. A suspended outcome means the result arrives later through a
 * resume signal.
 */
public record TaskOutcome(
    TaskStatus status,
    Severity severity,
    JsonNode payload,
    boolean suspended
) {
    public static TaskOutcome success(Severity severity, JsonNode payload) {
        return new TaskOutcome(TaskStatus.SUCCESS, severity, payload, false);
    }

    public static TaskOutcome success() {
        return success(Severity.NONE, null);
    }

    public static TaskOutcome failure(Severity severity, JsonNode payload) {
        return new TaskOutcome(TaskStatus.FAILURE, severity, payload, false);
    }

    public static TaskOutcome suspendedOutcome() {
        return new TaskOutcome(null, null, null, true);
    }
}

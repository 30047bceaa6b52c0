package com.reviewgate.core.invocation;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;

/**
 * A single call to a remote task. The idempotency key is stable across
 * re-dispatches of the same attempt, so the remote side can deduplicate.
 */
public record TaskInvocation(
    String runId,
    String taskId,
    String taskRef,
    int attempt,
    String idempotencyKey,
    JsonNode payload,
    Duration timeout
) {
}

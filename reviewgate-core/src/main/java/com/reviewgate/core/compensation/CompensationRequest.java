package com.reviewgate.core.compensation;

import com.fasterxml.jackson.databind.JsonNode;
import com.reviewgate.core.model.RunStatus;

/**
 * A compensation action to issue for a blocked or failed run.
 * The idempotency key is {@code runId:actionId}.
 */
public record CompensationRequest(
    String runId,
    String subjectId,
    String actionId,
    String actionType,
    JsonNode params,
    RunStatus runStatus,
    String reason,
    String idempotencyKey
) {
}

package com.reviewgate.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A compensation action declared by a pipeline, e.g. opening a tracking ticket
 * when a change is blocked.
 */
public record CompensationActionSpec(
    String id,
    String actionType,
    JsonNode params
) {
}

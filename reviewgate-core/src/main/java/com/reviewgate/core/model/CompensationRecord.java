package com.reviewgate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/**
 * Outcome of one declared compensation action for a run.
 * Replayed passes skip EXECUTED records and re-issue the others.
 */
public record CompensationRecord(
    String actionId,
    String actionType,
    CompensationStatus status,
    int attempts,
    String lastError,
    Instant executedAt
) {
    public static CompensationRecord pending(CompensationActionSpec spec) {
        return new CompensationRecord(spec.id(), spec.actionType(), CompensationStatus.PENDING, 0, null, null);
    }

    public CompensationRecord executed(Instant at) {
        return new CompensationRecord(actionId, actionType, CompensationStatus.EXECUTED, attempts + 1, null, at);
    }

    public CompensationRecord failed(String error) {
        return new CompensationRecord(actionId, actionType, CompensationStatus.FAILED, attempts + 1, error, null);
    }

    @JsonIgnore
    public boolean isDone() {
        return status == CompensationStatus.EXECUTED;
    }
}

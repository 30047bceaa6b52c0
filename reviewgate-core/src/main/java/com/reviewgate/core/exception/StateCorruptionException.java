package com.reviewgate.core.exception;

/**
 * Thrown when a stored run record cannot be trusted: unreadable document or
 * an unsupported schema version. Fatal for that run only.
 */
public class StateCorruptionException extends ReviewGateException {

    public static final String ERROR_CODE = "STATE_CORRUPTED";

    private final String runId;

    public StateCorruptionException(String runId, String reason) {
        super(ERROR_CODE, String.format("Run state %s is corrupted: %s", runId, reason));
        this.runId = runId;
    }

    public StateCorruptionException(String runId, String reason, Throwable cause) {
        super(ERROR_CODE, String.format("Run state %s is corrupted: %s", runId, reason), cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}

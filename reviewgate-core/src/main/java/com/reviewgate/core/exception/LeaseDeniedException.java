package com.reviewgate.core.exception;

/**
 * Thrown when a run's owner lease is held by another process.
 */
public class LeaseDeniedException extends ReviewGateException {

    public static final String ERROR_CODE = "LEASE_DENIED";

    public LeaseDeniedException(String runId, String currentOwner) {
        super(ERROR_CODE, String.format(
            "Failed to claim run '%s': currently owned by %s",
            runId, currentOwner
        ));
    }
}

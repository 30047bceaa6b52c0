package com.reviewgate.core.exception;

import com.reviewgate.core.model.RunStatus;

/**
 * Thrown when an invalid run state transition is attempted.
 */
public class InvalidStateTransitionException extends ReviewGateException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(RunStatus currentStatus, RunStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition from %s to %s",
            currentStatus, targetStatus
        ));
    }

    public InvalidStateTransitionException(String runId, RunStatus currentStatus, String operation) {
        super(ERROR_CODE, String.format(
            "Run %s in status %s cannot %s",
            runId, currentStatus, operation
        ));
    }
}

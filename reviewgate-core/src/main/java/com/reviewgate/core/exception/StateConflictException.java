package com.reviewgate.core.exception;

/**
 * Thrown when a conditional write loses against a concurrent writer.
 * Callers reload and reapply; it never reaches a trigger caller.
 */
public class StateConflictException extends ReviewGateException {

    public static final String ERROR_CODE = "STATE_CONFLICT";

    private final String runId;

    public StateConflictException(String runId, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Conditional write conflict on run[%s]: expected version %d, actual version %d",
            runId, expectedVersion, actualVersion
        ));
        this.runId = runId;
    }

    public StateConflictException(String runId, int attempts) {
        super(ERROR_CODE, String.format(
            "Gave up writing run[%s] after %d conflicting attempts",
            runId, attempts
        ));
        this.runId = runId;
    }

    private StateConflictException(String runId, String message) {
        super(ERROR_CODE, message);
        this.runId = runId;
    }

    /**
     * A run with the same ID already exists.
     */
    public static StateConflictException duplicate(String runId) {
        return new StateConflictException(runId, String.format("Run[%s] already exists", runId));
    }

    /**
     * The row changed between read and write.
     */
    public static StateConflictException lostRace(String runId, long expectedVersion) {
        return new StateConflictException(runId, String.format(
            "Conditional write conflict on run[%s]: version %d is no longer current",
            runId, expectedVersion
        ));
    }

    public String getRunId() {
        return runId;
    }
}

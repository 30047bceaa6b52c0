package com.reviewgate.core.exception;

/**
 * Thrown by task invokers on transport or infrastructure failure.
 * Absorbed into a task result by the engine; never surfaces to a caller.
 */
public class TaskInvocationException extends Exception {

    public static final String TIMEOUT = "TIMEOUT";
    public static final String TRANSPORT = "TRANSPORT_ERROR";
    public static final String REJECTED = "REJECTED";

    private final String errorCode;
    private final boolean retryable;

    public TaskInvocationException(String errorCode, String message) {
        this(errorCode, message, null, true);
    }

    public TaskInvocationException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, null, retryable);
    }

    public TaskInvocationException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (the remote side rejected the call).
     */
    public static TaskInvocationException permanent(String errorCode, String message) {
        return new TaskInvocationException(errorCode, message, false);
    }

    /**
     * Create a retryable exception (transient transport failure).
     */
    public static TaskInvocationException transientFailure(String errorCode, String message, Throwable cause) {
        return new TaskInvocationException(errorCode, message, cause, true);
    }
}

package com.reviewgate.core.exception;

/**
 * Thrown by a compensation gateway when an action could not be issued.
 */
public class CompensationException extends Exception {

    private final String errorCode;

    public CompensationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CompensationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

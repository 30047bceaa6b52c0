package com.reviewgate.core.exception;

/**
 * Base exception for all review gate errors.
 */
public class ReviewGateException extends RuntimeException {

    private final String errorCode;

    public ReviewGateException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ReviewGateException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

package com.reviewgate.core.exception;

/**
 * Thrown when a run or pipeline definition is not found.
 */
public class NotFoundException extends ReviewGateException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}

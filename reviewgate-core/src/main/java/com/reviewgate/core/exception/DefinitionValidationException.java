package com.reviewgate.core.exception;

import java.util.List;

/**
 * Thrown when a pipeline definition is rejected before any task executes.
 */
public class DefinitionValidationException extends ReviewGateException {

    public static final String ERROR_CODE = "DEFINITION_INVALID";

    private final List<String> violations;

    public DefinitionValidationException(String field, String reason) {
        this(List.of(field + ": " + reason));
    }

    public DefinitionValidationException(List<String> violations) {
        super(ERROR_CODE, "Invalid pipeline definition: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public DefinitionValidationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.violations = List.of(message);
    }

    public List<String> getViolations() {
        return violations;
    }
}

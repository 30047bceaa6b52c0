package com.reviewgate.core.model;

/**
 * Machine-readable reason attached to a {@link Decision}.
 */
public enum ReasonCode {
    OVERRIDE_APPLIED,
    REQUIRED_TASK_FAILED,
    SEVERITY_THRESHOLD,
    SEVERITY_COUNT_EXCEEDED,
    NO_BLOCKING_ISSUES
}

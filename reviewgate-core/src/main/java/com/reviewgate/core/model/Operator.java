package com.reviewgate.core.model;

/**
 * Comparison operators available to FIELD and RESULT conditions.
 */
public enum Operator {
    EQ,
    NE,
    GT,
    LT,
    CONTAINS,
    /**
     * Regular expression match against the textual value.
     */
    MATCHES,
    EXISTS,
    NOT_EXISTS;

    /**
     * Check whether the operator needs an operand value.
     */
    public boolean requiresValue() {
        return this != EXISTS && this != NOT_EXISTS;
    }
}

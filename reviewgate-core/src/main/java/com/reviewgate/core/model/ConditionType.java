package com.reviewgate.core.model;

/**
 * Variants of a {@link Condition}.
 */
public enum ConditionType {
    ALWAYS,
    NEVER,
    /**
     * Dotted path into the run context.
     */
    FIELD,
    /**
     * Field of a prior task's recorded result.
     */
    RESULT,
    /**
     * Named predicate resolved from a fixed registry.
     */
    CUSTOM
}

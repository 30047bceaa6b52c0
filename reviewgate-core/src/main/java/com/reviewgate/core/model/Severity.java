package com.reviewgate.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity reported by a task. Declaration order is the severity order.
 */
public enum Severity {
    NONE(0),
    LOW(1),
    MEDIUM(3),
    HIGH(7),
    CRITICAL(15);

    private final int defaultWeight;

    Severity(int defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    /**
     * Weight used by WEIGHTED aggregation when the policy does not override it.
     */
    public int defaultWeight() {
        return defaultWeight;
    }

    public boolean atLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity max(Severity a, Severity b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Parse a severity name case-insensitively.
     *
     * @param value raw value, may be null
     * @return the severity, or empty if the value is not a known name
     */
    public static Optional<Severity> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Severity.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

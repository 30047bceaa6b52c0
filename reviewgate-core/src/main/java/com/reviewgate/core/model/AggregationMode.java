package com.reviewgate.core.model;

/**
 * How the overall severity of a run is derived.
 */
public enum AggregationMode {
    /**
     * Highest severity across non-skipped results.
     */
    MAX,

    /**
     * Highest severity whose weight does not exceed the sum of result weights.
     */
    WEIGHTED
}

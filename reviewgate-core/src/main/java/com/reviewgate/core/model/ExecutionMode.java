package com.reviewgate.core.model;

/**
 * How the tasks of a stage are dispatched.
 */
public enum ExecutionMode {
    /**
     * One task at a time, in declared order.
     */
    SEQUENTIAL,

    /**
     * Up to the stage parallelism cap at once; the remainder is queued.
     */
    PARALLEL
}

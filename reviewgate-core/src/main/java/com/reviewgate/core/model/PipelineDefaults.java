package com.reviewgate.core.model;

import java.time.Duration;

/**
 * Global defaults applied to every stage and task that does not override them.
 */
public record PipelineDefaults(
    Duration taskTimeout,
    RetryPolicy retryPolicy,
    Integer parallelism,
    Boolean failFast,
    Duration waitTimeout
) {
    public static final Duration DEFAULT_TASK_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofHours(24);
    public static final int DEFAULT_PARALLELISM = 4;

    public static PipelineDefaults standard() {
        return new PipelineDefaults(
            DEFAULT_TASK_TIMEOUT,
            RetryPolicy.defaultPolicy(),
            DEFAULT_PARALLELISM,
            Boolean.TRUE,
            DEFAULT_WAIT_TIMEOUT
        );
    }

    /**
     * Fill every unset field from the given fallback.
     */
    public PipelineDefaults orElse(PipelineDefaults fallback) {
        if (fallback == null) {
            return this;
        }
        return new PipelineDefaults(
            taskTimeout != null ? taskTimeout : fallback.taskTimeout(),
            retryPolicy != null ? retryPolicy : fallback.retryPolicy(),
            parallelism != null ? parallelism : fallback.parallelism(),
            failFast != null ? failFast : fallback.failFast(),
            waitTimeout != null ? waitTimeout : fallback.waitTimeout()
        );
    }
}

package com.reviewgate.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Tags every log line emitted inside the block with run and task identifiers.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(runId, stageId, taskId, attempt)) {
 *     log.info("Invoking task"); // includes runId, stageId, taskId, attempt
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String SUBJECT_ID = "subjectId";
    public static final String STAGE_ID = "stageId";
    public static final String TASK_ID = "taskId";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private final String[] keys;

    private LoggingContext(String... keys) {
        this.keys = keys;
    }

    /**
     * Create a logging context for run-level operations.
     */
    public static LoggingContext forRun(String runId, String subjectId) {
        put(RUN_ID, runId);
        put(SUBJECT_ID, subjectId);
        ensureTraceId();
        return new LoggingContext(RUN_ID, SUBJECT_ID);
    }

    /**
     * Create a logging context for a stage of the current run.
     */
    public static LoggingContext forStage(String stageId) {
        put(STAGE_ID, stageId);
        return new LoggingContext(STAGE_ID);
    }

    /**
     * Create a logging context for a task attempt. Used on dispatch pool
     * threads, which do not inherit the caller's MDC.
     */
    public static LoggingContext forTask(String runId, String stageId, String taskId, int attempt) {
        put(RUN_ID, runId);
        put(STAGE_ID, stageId);
        put(TASK_ID, taskId);
        MDC.put(ATTEMPT, String.valueOf(attempt));
        ensureTraceId();
        return new LoggingContext(RUN_ID, STAGE_ID, TASK_ID, ATTEMPT);
    }

    public static String getRunId() {
        return MDC.get(RUN_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        // TRACE_ID stays for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a worker loop iteration.
     */
    public static void clearAll() {
        MDC.clear();
    }
}

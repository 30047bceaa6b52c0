package com.reviewgate.engine.metrics;

import com.reviewgate.engine.events.RunEvent;
import com.reviewgate.engine.events.RunEventListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer metrics for the review pipeline engine, fed from run events.
 *
 * Metrics exposed:
 * - Runs by terminal status
 * - Task latency and outcomes
 * - Retries, skips, suspensions
 * - Compensation outcomes
 * - SLA breaches
 */
public class PipelineMetrics implements RunEventListener {

    public static final String RUNS_STARTED = "reviewgate.runs.started";
    public static final String RUNS_COMPLETED = "reviewgate.runs.completed";
    public static final String RUNS_SUSPENDED = "reviewgate.runs.suspended";

    public static final String TASK_DURATION = "reviewgate.task.duration";
    public static final String TASK_OUTCOMES = "reviewgate.task.outcomes";
    public static final String TASK_RETRIES = "reviewgate.task.retries";
    public static final String TASK_SKIPS = "reviewgate.task.skips";

    public static final String COMPENSATIONS = "reviewgate.compensations";
    public static final String SLA_BREACHES = "reviewgate.sla.breaches";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onEvent(RunEvent event) {
        String pipeline = event.definitionRef() != null ? event.definitionRef() : "unknown";
        switch (event.type()) {
            case RUN_STARTED, RUN_RESUMED -> runStarted(pipeline, event.type().name());
            case RUN_SUSPENDED -> runSuspended(pipeline);
            case RUN_DECIDED, RUN_CANCELLED, RUN_FAILED -> runCompleted(pipeline, event.attribute("status"));
            case TASK_COMPLETED, TASK_TIMED_OUT -> taskCompleted(event.taskId(), event.attribute("status"),
                event.attribute("durationMs"));
            case TASK_RETRIED -> taskRetried(event.taskId(), event.attribute("errorCode"));
            case TASK_SKIPPED -> taskSkipped(event.taskId());
            case COMPENSATION_EXECUTED -> compensation(event.attribute("actionType"), "executed");
            case COMPENSATION_FAILED -> compensation(event.attribute("actionType"), "failed");
            case SLA_BREACHED -> slaBreached(pipeline);
            default -> {
                // no metric
            }
        }
    }

    // ========== Run Metrics ==========

    public void runStarted(String pipeline, String trigger) {
        Counter.builder(RUNS_STARTED)
            .tag("pipeline", pipeline)
            .tag("trigger", trigger)
            .description("Runs picked up by the engine")
            .register(registry)
            .increment();
    }

    public void runSuspended(String pipeline) {
        Counter.builder(RUNS_SUSPENDED)
            .tag("pipeline", pipeline)
            .description("Runs suspended awaiting an external signal")
            .register(registry)
            .increment();
    }

    public void runCompleted(String pipeline, String status) {
        Counter.builder(RUNS_COMPLETED)
            .tag("pipeline", pipeline)
            .tag("status", status != null ? status : "UNKNOWN")
            .description("Runs reaching a terminal state")
            .register(registry)
            .increment();
    }

    // ========== Task Metrics ==========

    public void taskCompleted(String taskId, String status, String durationMs) {
        String outcome = status != null ? status : "UNKNOWN";
        Counter.builder(TASK_OUTCOMES)
            .tag("task", taskId)
            .tag("status", outcome)
            .description("Recorded task results")
            .register(registry)
            .increment();

        if (durationMs != null) {
            Timer.builder(TASK_DURATION)
                .tag("task", taskId)
                .tag("status", outcome)
                .description("Task latency including retries")
                .register(registry)
                .record(Duration.ofMillis(Long.parseLong(durationMs)));
        }
    }

    public void taskRetried(String taskId, String errorCode) {
        Counter.builder(TASK_RETRIES)
            .tag("task", taskId)
            .tag("error_code", errorCode != null ? errorCode : "UNKNOWN")
            .description("Task invocation retries")
            .register(registry)
            .increment();
    }

    public void taskSkipped(String taskId) {
        Counter.builder(TASK_SKIPS)
            .tag("task", taskId)
            .description("Tasks skipped by a condition")
            .register(registry)
            .increment();
    }

    // ========== Compensation and SLA Metrics ==========

    public void compensation(String actionType, String outcome) {
        Counter.builder(COMPENSATIONS)
            .tag("action_type", actionType != null ? actionType : "UNKNOWN")
            .tag("outcome", outcome)
            .description("Compensation actions issued")
            .register(registry)
            .increment();
    }

    public void slaBreached(String pipeline) {
        Counter.builder(SLA_BREACHES)
            .tag("pipeline", pipeline)
            .description("Runs still active past their deadline")
            .register(registry)
            .increment();
    }
}

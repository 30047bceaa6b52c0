package com.reviewgate.engine.metrics;

import com.reviewgate.engine.events.RunEvent;
import com.reviewgate.engine.events.RunEventType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PipelineMetricsTest {

    private static final Instant AT = Instant.parse("2026-03-02T09:00:00Z");

    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
    }

    private static RunEvent.Builder event(RunEventType type) {
        return RunEvent.builder(type, "run-1", AT).definition("peer-review:1");
    }

    @Test
    void onEvent_runLifecycle_shouldCountByPipelineAndStatus() {
        metrics.onEvent(event(RunEventType.RUN_STARTED).build());
        metrics.onEvent(event(RunEventType.RUN_RESUMED).build());
        metrics.onEvent(event(RunEventType.RUN_SUSPENDED).build());
        metrics.onEvent(event(RunEventType.RUN_DECIDED).attr("status", "BLOCKED").build());
        metrics.onEvent(event(RunEventType.RUN_CANCELLED).attr("status", "CANCELLED").build());

        assertEquals(1.0, registry.get(PipelineMetrics.RUNS_STARTED).tag("trigger", "RUN_RESUMED").counter().count());
        assertEquals(1.0, registry.get(PipelineMetrics.RUNS_SUSPENDED).tag("pipeline", "peer-review:1").counter().count());
        assertEquals(1.0, registry.get(PipelineMetrics.RUNS_COMPLETED).tag("status", "BLOCKED").counter().count());
        assertEquals(1.0, registry.get(PipelineMetrics.RUNS_COMPLETED).tag("status", "CANCELLED").counter().count());
    }

    @Test
    void onEvent_taskCompletion_shouldRecordOutcomeAndLatency() {
        metrics.onEvent(event(RunEventType.TASK_COMPLETED).task("security")
            .attr("status", "SUCCESS").attr("durationMs", 1500).build());
        metrics.onEvent(event(RunEventType.TASK_TIMED_OUT).task("security")
            .attr("status", "TIMEOUT").build());

        assertEquals(1.0, registry.get(PipelineMetrics.TASK_OUTCOMES).tag("status", "SUCCESS").counter().count());
        assertEquals(1.0, registry.get(PipelineMetrics.TASK_OUTCOMES).tag("status", "TIMEOUT").counter().count());
        assertEquals(1500.0, registry.get(PipelineMetrics.TASK_DURATION).tag("task", "security").timer()
            .totalTime(TimeUnit.MILLISECONDS));
        assertNull(registry.find(PipelineMetrics.TASK_DURATION).tag("status", "TIMEOUT").timer());
    }

    @Test
    void onEvent_retriesSkipsCompensationAndSla_shouldBeCounted() {
        metrics.onEvent(event(RunEventType.TASK_RETRIED).task("lint").attr("errorCode", "TRANSPORT_ERROR").build());
        metrics.onEvent(event(RunEventType.TASK_SKIPPED).task("lld-alignment").build());
        metrics.onEvent(event(RunEventType.COMPENSATION_FAILED).attr("actionType", "OPEN_TICKET").build());
        metrics.onEvent(event(RunEventType.SLA_BREACHED).build());

        assertEquals(1.0, registry.get(PipelineMetrics.TASK_RETRIES).tag("error_code", "TRANSPORT_ERROR").counter().count());
        assertEquals(1.0, registry.get(PipelineMetrics.TASK_SKIPS).tag("task", "lld-alignment").counter().count());
        assertEquals(1.0, registry.get(PipelineMetrics.COMPENSATIONS).tag("outcome", "failed").counter().count());
        assertEquals(1.0, registry.get(PipelineMetrics.SLA_BREACHES).counter().count());
    }

    @Test
    void onEvent_unmeteredEvent_shouldRegisterNothing() {
        metrics.onEvent(event(RunEventType.STAGE_STARTED).stage("analysis").build());

        assertEquals(0, registry.getMeters().size());
    }
}

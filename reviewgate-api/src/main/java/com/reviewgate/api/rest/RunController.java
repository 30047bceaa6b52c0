package com.reviewgate.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.reviewgate.core.model.CompensationRecord;
import com.reviewgate.core.model.Decision;
import com.reviewgate.core.model.PendingTask;
import com.reviewgate.core.model.RunContext;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.model.RunStatus;
import com.reviewgate.core.model.Severity;
import com.reviewgate.core.model.TaskResult;
import com.reviewgate.core.model.TaskStatus;
import com.reviewgate.engine.service.RunTrigger;
import com.reviewgate.engine.service.RunTrigger.ResumeSignal;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API for review runs.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private final RunTrigger runTrigger;

    public RunController(RunTrigger runTrigger) {
        this.runTrigger = runTrigger;
    }

    /**
     * Start a review run of a pipeline for one subject.
     */
    @PostMapping
    public ResponseEntity<RunResponse> createRun(@RequestBody CreateRunRequest request) {
        if (request.pipeline() == null || request.pipeline().isBlank()) {
            throw new IllegalArgumentException("pipeline is required");
        }
        String runId = runTrigger.createRun(request.pipeline(),
            new RunContext(request.subjectId(), request.attributes(), request.labels()));

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(RunResponse.from(runTrigger.getRun(runId)));
    }

    /**
     * Get run by ID.
     */
    @GetMapping("/{runId}")
    public ResponseEntity<RunResponse> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(RunResponse.from(runTrigger.getRun(runId)));
    }

    /**
     * Cancel a run.
     */
    @PostMapping("/{runId}/cancel")
    public ResponseEntity<RunResponse> cancelRun(
            @PathVariable String runId,
            @RequestBody(required = false) CancelRequest request) {

        String reason = request != null && request.reason() != null ? request.reason() : "Manual cancellation";
        return ResponseEntity.ok(RunResponse.from(runTrigger.cancelRun(runId, reason)));
    }

    /**
     * Deliver the result of a suspended task.
     */
    @PostMapping("/{runId}/signal")
    public ResponseEntity<RunResponse> signal(
            @PathVariable String runId,
            @RequestBody SignalRequest request) {

        RunState state = runTrigger.resumeSignal(runId, new ResumeSignal(
            request.taskId(),
            request.status(),
            request.severity(),
            request.payload()
        ));
        return ResponseEntity.ok(RunResponse.from(state));
    }

    // ========== DTOs ==========

    public record CreateRunRequest(
        String pipeline,
        String subjectId,
        JsonNode attributes,
        Set<String> labels
    ) {}

    public record CancelRequest(String reason) {}

    public record SignalRequest(
        String taskId,
        TaskStatus status,
        Severity severity,
        JsonNode payload
    ) {}

    public record RunResponse(
        String runId,
        String pipeline,
        String subjectId,
        RunStatus status,
        int currentStage,
        Map<String, TaskResult> results,
        List<String> pendingTasks,
        List<CompensationRecord> compensationActions,
        Decision decision,
        String reason,
        boolean cancelRequested,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        Instant deadline
    ) {
        public static RunResponse from(RunState state) {
            return new RunResponse(
                state.runId(),
                state.definitionRef(),
                state.context().subjectId(),
                state.status(),
                state.currentStage(),
                state.results(),
                state.pendingTasks().values().stream().map(PendingTask::taskId).toList(),
                state.compensationActions(),
                state.decision(),
                state.reason(),
                state.cancelRequested(),
                state.createdAt(),
                state.updatedAt(),
                state.completedAt(),
                state.deadline()
            );
        }
    }
}

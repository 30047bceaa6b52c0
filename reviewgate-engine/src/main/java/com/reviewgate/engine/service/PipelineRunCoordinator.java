package com.reviewgate.engine.service;

import com.reviewgate.core.exception.InvalidStateTransitionException;
import com.reviewgate.core.exception.LeaseDeniedException;
import com.reviewgate.core.exception.NotFoundException;
import com.reviewgate.core.exception.ReviewGateException;
import com.reviewgate.core.exception.StateConflictException;
import com.reviewgate.core.model.PendingTask;
import com.reviewgate.core.model.PipelineDefinition;
import com.reviewgate.core.model.RunContext;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.model.RunStatus;
import com.reviewgate.core.model.TaskResult;
import com.reviewgate.core.model.TaskStatus;
import com.reviewgate.core.repository.PipelineDefinitionRepository;
import com.reviewgate.core.repository.RunStateRepository;
import com.reviewgate.engine.events.RunEvent;
import com.reviewgate.engine.events.RunEventPublisher;
import com.reviewgate.engine.events.RunEventType;
import com.reviewgate.engine.execution.DefinitionValidator;
import com.reviewgate.engine.execution.PipelineExecutionEngine;
import com.reviewgate.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Creates runs and applies caller requests (cancel, resume signals) to them.
 *
 * The coordinator never executes stages itself: it records the request through
 * a conditional write and hands execution to the {@link PipelineExecutionEngine}
 * on the run executor.
 */
public class PipelineRunCoordinator implements RunTrigger {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunCoordinator.class);

    private static final int MAX_WRITE_ATTEMPTS = 5;

    private final PipelineDefinitionRepository definitions;
    private final RunStateRepository store;
    private final DefinitionValidator validator;
    private final PipelineExecutionEngine engine;
    private final Executor runExecutor;
    private final RunEventPublisher events;
    private final Clock clock;
    private final Duration runSla;

    public PipelineRunCoordinator(
            PipelineDefinitionRepository definitions,
            RunStateRepository store,
            DefinitionValidator validator,
            PipelineExecutionEngine engine,
            Executor runExecutor,
            RunEventPublisher events,
            Clock clock,
            Duration runSla) {
        this.definitions = definitions;
        this.store = store;
        this.validator = validator;
        this.engine = engine;
        this.runExecutor = runExecutor;
        this.events = events;
        this.clock = clock;
        this.runSla = runSla;
    }

    @Override
    public String createRun(String definitionRef, RunContext context) {
        if (context == null || context.subjectId() == null || context.subjectId().isBlank()) {
            throw new IllegalArgumentException("A run needs a subjectId");
        }
        log.info("Creating run of {} for subject {}", definitionRef, context.subjectId());

        PipelineDefinition definition = definitions.resolve(definitionRef)
            .orElseThrow(() -> new NotFoundException("PipelineDefinition", definitionRef));
        validator.validate(definition);

        Instant now = clock.instant();
        String runId = UUID.randomUUID().toString();
        Instant deadline = runSla != null ? now.plus(runSla) : null;
        RunState created = store.create(RunState.create(runId, definition, context, now, deadline));

        try (var ctx = LoggingContext.forRun(runId, context.subjectId())) {
            events.publish(RunEvent.builder(RunEventType.RUN_CREATED, runId, now)
                .definition(created.definitionRef())
                .attr("subjectId", context.subjectId())
                .build());
            supersedeOlderRuns(definition, context.subjectId(), runId);
            log.info("Created run {} of {}", runId, definition.id());
        }

        schedule(runId);
        return runId;
    }

    @Override
    public RunState getRun(String runId) {
        return store.get(runId).orElseThrow(() -> new NotFoundException("Run", runId));
    }

    @Override
    public RunState cancelRun(String runId, String reason) {
        String why = reason != null && !reason.isBlank() ? reason : "cancelled";
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            RunState current = getRun(runId);
            if (current.status() == RunStatus.CANCELLED) {
                return current;
            }
            if (current.isTerminal()) {
                throw new InvalidStateTransitionException(runId, current.status(), "be cancelled");
            }

            Instant now = clock.instant();
            boolean direct = current.status() == RunStatus.SUSPENDED || !current.isLeased(now);
            RunState next = direct
                ? current.toBuilder()
                    .status(RunStatus.CANCELLED)
                    .cancelRequested(true, why)
                    .reason(why)
                    .lease(null)
                    .completedAt(now)
                    .updatedAt(now)
                    .build()
                : current.toBuilder()
                    .cancelRequested(true, why)
                    .updatedAt(now)
                    .build();

            RunState stored;
            try {
                stored = store.conditionalPut(next, current.version());
            } catch (StateConflictException e) {
                log.debug("Cancel of run {} lost a write race (attempt {}), retrying", runId, attempt);
                continue;
            }

            try (var ctx = LoggingContext.forRun(runId, current.context().subjectId())) {
                if (direct) {
                    log.info("Cancelled run {}: {}", runId, why);
                    events.publish(RunEvent.builder(RunEventType.RUN_CANCELLED, runId, now)
                        .definition(stored.definitionRef())
                        .attr("status", RunStatus.CANCELLED)
                        .attr("reason", why)
                        .build());
                } else {
                    log.info("Cancel requested for run {} owned by {}: {}", runId, current.lease().ownerId(), why);
                    engine.interruptInFlight(runId);
                }
            }
            return stored;
        }
        throw new StateConflictException(runId, MAX_WRITE_ATTEMPTS);
    }

    @Override
    public RunState resumeSignal(String runId, ResumeSignal signal) {
        if (signal == null || signal.taskId() == null || signal.status() == null) {
            throw new IllegalArgumentException("A signal needs a taskId and a status");
        }
        if (signal.status() == TaskStatus.SKIPPED) {
            throw new IllegalArgumentException("A signal cannot report SKIPPED");
        }

        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            RunState current = getRun(runId);
            if (current.isTerminal()) {
                throw new InvalidStateTransitionException(runId, current.status(), "accept signals");
            }
            if (current.hasResult(signal.taskId())) {
                log.info("Ignoring signal for task {} of run {}: result already recorded", signal.taskId(), runId);
                return current;
            }
            PendingTask pending = current.pendingTasks().get(signal.taskId());
            if (pending == null) {
                throw new NotFoundException("PendingTask", runId + ":" + signal.taskId());
            }

            Instant now = clock.instant();
            TaskResult result = new TaskResult(
                signal.taskId(), signal.status(), signal.severity(), signal.payload(),
                pending.suspendedAt(), now, pending.attempt(), pending.attempt() - 1,
                pending.idempotencyKey(), null, null
            );
            RunState stored;
            try {
                stored = store.conditionalPut(
                    current.withResult(result).toBuilder().updatedAt(now).build(), current.version());
            } catch (StateConflictException e) {
                log.debug("Signal for run {} lost a write race (attempt {}), retrying", runId, attempt);
                continue;
            }

            try (var ctx = LoggingContext.forRun(runId, current.context().subjectId())) {
                log.info("Recorded signal for task {}: {} / {}", signal.taskId(), result.status(), result.severity());
                events.publish(RunEvent.builder(RunEventType.TASK_COMPLETED, runId, now)
                    .definition(stored.definitionRef())
                    .task(signal.taskId())
                    .attr("status", result.status())
                    .attr("severity", result.severity())
                    .attr("attempt", result.attempt())
                    .attr("durationMs", Duration.between(pending.suspendedAt(), now).toMillis())
                    .build());
            }

            // A running engine picks the result up at its next wave boundary
            if (stored.status() == RunStatus.SUSPENDED && stored.pendingTasks().isEmpty()) {
                schedule(runId);
            }
            return stored;
        }
        throw new StateConflictException(runId, MAX_WRITE_ATTEMPTS);
    }

    private void supersedeOlderRuns(PipelineDefinition definition, String subjectId, String newRunId) {
        for (RunState older : store.findActiveBySubject(definition.name(), subjectId)) {
            if (older.runId().equals(newRunId)) {
                continue;
            }
            try {
                RunState cancelled = cancelRun(older.runId(), "superseded by " + newRunId);
                events.publish(RunEvent.builder(RunEventType.RUN_SUPERSEDED, older.runId(), clock.instant())
                    .definition(cancelled.definitionRef())
                    .attr("supersededBy", newRunId)
                    .build());
                log.info("Run {} superseded by {}", older.runId(), newRunId);
            } catch (ReviewGateException e) {
                log.warn("Could not supersede run {}: {}", older.runId(), e.getMessage());
            }
        }
    }

    private void schedule(String runId) {
        runExecutor.execute(() -> {
            try {
                engine.execute(runId);
            } catch (LeaseDeniedException e) {
                log.debug("Run {} is owned elsewhere: {}", runId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Execution of run {} stopped with an error", runId, e);
            }
        });
    }
}

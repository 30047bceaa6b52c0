package com.reviewgate.engine.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reviewgate.core.exception.InvalidStateTransitionException;
import com.reviewgate.core.exception.LeaseDeniedException;
import com.reviewgate.core.exception.NotFoundException;
import com.reviewgate.core.exception.StateConflictException;
import com.reviewgate.core.exception.StateCorruptionException;
import com.reviewgate.core.model.AggregatedResult;
import com.reviewgate.core.model.CompensationActionSpec;
import com.reviewgate.core.model.CompensationRecord;
import com.reviewgate.core.model.Decision;
import com.reviewgate.core.model.DecisionPolicy;
import com.reviewgate.core.model.ExecutionMode;
import com.reviewgate.core.model.PendingTask;
import com.reviewgate.core.model.PipelineDefaults;
import com.reviewgate.core.model.PipelineDefinition;
import com.reviewgate.core.model.RunLease;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.model.RunStatus;
import com.reviewgate.core.model.Stage;
import com.reviewgate.core.model.TaskResult;
import com.reviewgate.core.model.TaskSpec;
import com.reviewgate.core.model.TaskStatus;
import com.reviewgate.core.repository.PipelineDefinitionRepository;
import com.reviewgate.core.repository.RunStateRepository;
import com.reviewgate.engine.aggregation.ResultAggregator;
import com.reviewgate.engine.compensation.CompensationHandler;
import com.reviewgate.engine.condition.ConditionEvaluator;
import com.reviewgate.engine.decision.DecisionEngine;
import com.reviewgate.engine.events.RunEvent;
import com.reviewgate.engine.events.RunEventPublisher;
import com.reviewgate.engine.events.RunEventType;
import com.reviewgate.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Drives one run from its current stage to a terminal state or a suspension.
 *
 * Execution flow:
 * 1. Claim the run's lease (conditional write)
 * 2. Record expired waits as TIMEOUT; stay suspended while signals are outstanding
 * 3. For each stage from {@code currentStage}: evaluate its condition, dispatch
 *    its waves, persist every result as it arrives
 * 4. Aggregate, decide, persist the terminal state, compensate on BLOCKED
 *
 * Everything is reloaded from the {@link RunStateRepository}, so any process
 * may resume any unowned run and recorded tasks are never dispatched again.
 * A lost write race reloads and reapplies the change; a lost lease stops the
 * engine without further writes.
 */
public class PipelineExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutionEngine.class);

    private static final int MAX_WRITE_ATTEMPTS = 10;

    static final String FAIL_FAST_REASON = "not run: fail-fast";
    static final String STAGE_CONDITION_REASON = "stage condition false";
    static final String TASK_CONDITION_REASON = "task condition false";

    private final RunStateRepository store;
    private final PipelineDefinitionRepository definitions;
    private final ConditionEvaluator conditions;
    private final WavePlanner wavePlanner;
    private final TaskDispatcher dispatcher;
    private final ExecutorService dispatchPool;
    private final ResultAggregator aggregator;
    private final DecisionEngine decisionEngine;
    private final CompensationHandler compensationHandler;
    private final RunEventPublisher events;
    private final EngineSettings settings;
    private final Clock clock;

    // Runs executing in this process, with their in-flight dispatches
    private final Map<String, Set<Future<?>>> inFlight = new ConcurrentHashMap<>();

    public PipelineExecutionEngine(
            RunStateRepository store,
            PipelineDefinitionRepository definitions,
            ConditionEvaluator conditions,
            WavePlanner wavePlanner,
            TaskDispatcher dispatcher,
            ExecutorService dispatchPool,
            ResultAggregator aggregator,
            DecisionEngine decisionEngine,
            CompensationHandler compensationHandler,
            RunEventPublisher events,
            EngineSettings settings,
            Clock clock) {
        this.store = store;
        this.definitions = definitions;
        this.conditions = conditions;
        this.wavePlanner = wavePlanner;
        this.dispatcher = dispatcher;
        this.dispatchPool = dispatchPool;
        this.aggregator = aggregator;
        this.decisionEngine = decisionEngine;
        this.compensationHandler = compensationHandler;
        this.events = events;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Execute or resume a run until it is terminal, suspended, or owned elsewhere.
     *
     * @param runId The run to drive
     * @return The last state this engine read or wrote
     * @throws LeaseDeniedException if another process owns the run
     * @throws NotFoundException if the run does not exist
     * @throws StateCorruptionException if the stored record cannot be read; the run is moved to FAILED
     */
    public RunState execute(String runId) {
        if (inFlight.putIfAbsent(runId, ConcurrentHashMap.newKeySet()) != null) {
            log.debug("Run {} is already executing in this process", runId);
            return store.get(runId).orElseThrow(() -> new NotFoundException("Run", runId));
        }
        try {
            RunState claimed;
            try {
                claimed = store.leaseClaim(runId, settings.ownerId(), settings.leaseDuration());
            } catch (InvalidStateTransitionException e) {
                log.debug("Run {} is already terminal", runId);
                return store.get(runId).orElseThrow(() -> new NotFoundException("Run", runId));
            }

            RunCursor cursor = new RunCursor(claimed);
            try (var ctx = LoggingContext.forRun(runId, claimed.context().subjectId())) {
                return drive(cursor);
            }
        } catch (StateCorruptionException e) {
            failCorrupt(runId, e);
            throw e;
        } finally {
            inFlight.remove(runId);
        }
    }

    /**
     * Interrupt the in-flight task invocations of a run executing in this
     * process. Their late results are discarded.
     *
     * @param runId The run ID
     * @return true if the run was executing here
     */
    public boolean interruptInFlight(String runId) {
        Set<Future<?>> running = inFlight.get(runId);
        if (running == null) {
            return false;
        }
        log.info("Interrupting {} in-flight task(s) of run {}", running.size(), runId);
        cancelAll(running);
        return true;
    }

    public boolean isExecuting(String runId) {
        return inFlight.containsKey(runId);
    }

    private RunState drive(RunCursor cursor) {
        try {
            Optional<PipelineDefinition> definition = definitions.find(
                cursor.state.definitionName(), cursor.state.definitionVersion());
            if (definition.isEmpty()) {
                return fail(cursor, "pipeline definition " + cursor.state.definitionRef() + " is not registered");
            }
            cursor.definition = definition.get();
            return advance(cursor);
        } catch (LeaseDeniedException e) {
            log.warn("Stopped driving run {}: {}", cursor.runId, e.getMessage());
            cancelAll(inFlight.get(cursor.runId));
            return cursor.state;
        } catch (StateCorruptionException e) {
            cancelAll(inFlight.get(cursor.runId));
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected engine error on run {}", cursor.runId, e);
            return fail(cursor, "engine error: " + e.getMessage());
        }
    }

    /**
     * The record cannot be rewritten through the state document, so the store
     * moves it to FAILED directly.
     */
    private void failCorrupt(String runId, StateCorruptionException e) {
        log.error("Run {} has an unreadable record", runId, e);
        if (store.markCorrupt(runId, e.getMessage())) {
            events.publish(RunEvent.builder(RunEventType.RUN_FAILED, runId, clock.instant())
                .attr("status", RunStatus.FAILED)
                .attr("reason", e.getMessage())
                .build());
        }
    }

    private RunState advance(RunCursor cursor) {
        if (cursor.state.cancelRequested()) {
            return cancel(cursor);
        }
        if (settlePending(cursor)) {
            RunState suspended = suspend(cursor);
            if (suspended.status() == RunStatus.SUSPENDED) {
                return suspended;
            }
        }
        startOrResume(cursor);

        List<Stage> stages = cursor.definition.stages();
        while (cursor.state.currentStage() < stages.size()) {
            int index = cursor.state.currentStage();
            Stage stage = stages.get(index);

            StageOutcome outcome;
            try (var stageCtx = LoggingContext.forStage(stage.id())) {
                outcome = runStage(cursor, stage);
            }

            switch (outcome) {
                case COMPLETED -> completeStage(cursor, index, stage);
                case FAIL_FAST -> skipRemaining(cursor);
                case SUSPENDED -> {
                    RunState suspended = suspend(cursor);
                    if (suspended.status() == RunStatus.SUSPENDED) {
                        return suspended;
                    }
                }
                case CANCELLED -> {
                    return cancel(cursor);
                }
                case ABANDONED -> {
                    return abandon(cursor);
                }
            }
        }
        return decide(cursor);
    }

    // ========== Stages and Waves ==========

    private StageOutcome runStage(RunCursor cursor, Stage stage) {
        if (!conditions.evaluate(stage.condition(), cursor.state.context(), cursor.state.results())) {
            skipStage(cursor, stage);
            return StageOutcome.COMPLETED;
        }
        if (failFastTriggered(cursor, stage)) {
            return StageOutcome.FAIL_FAST;
        }

        events.publish(event(RunEventType.STAGE_STARTED, cursor).stage(stage.id())
            .attr("mode", stage.mode())
            .build());

        for (List<TaskSpec> wave : wavePlanner.plan(stage)) {
            StageOutcome waveOutcome = runWave(cursor, stage, wave);
            if (waveOutcome != StageOutcome.COMPLETED) {
                return waveOutcome;
            }
            refresh(cursor);
            if (cursor.state.cancelRequested()) {
                return StageOutcome.CANCELLED;
            }
            if (!cursor.state.pendingTasks().isEmpty()) {
                return StageOutcome.SUSPENDED;
            }
        }
        return StageOutcome.COMPLETED;
    }

    private StageOutcome runWave(RunCursor cursor, Stage stage, List<TaskSpec> wave) {
        PipelineDefaults defaults = cursor.definition.defaults();
        int parallelism = stage.effectiveParallelism(defaults);
        boolean failFast = stage.effectiveFailFast(defaults);

        boolean sequential = stage.mode() == ExecutionMode.SEQUENTIAL;

        Deque<TaskSpec> queue = new ArrayDeque<>();
        for (TaskSpec task : wave) {
            if (sequential && cursor.state.pendingTasks().containsKey(task.id())) {
                // Later tasks wait for the suspended one
                log.debug("Task {} is awaiting a signal; stage {} holds", task.id(), stage.id());
                return StageOutcome.SUSPENDED;
            }
            if (cursor.state.hasResult(task.id()) || cursor.state.pendingTasks().containsKey(task.id())) {
                log.debug("Task {} already recorded, not dispatching", task.id());
            } else {
                queue.add(task);
            }
        }
        if (queue.isEmpty()) {
            return StageOutcome.COMPLETED;
        }

        // Parallel tasks see only results from before their wave, also when the wave is resumed
        Map<String, TaskResult> waveResults = sequential ? null : resultsBefore(cursor.state, wave);

        Set<Future<?>> running = inFlight.get(cursor.runId);
        CompletionService<DispatchResult> completion = new ExecutorCompletionService<>(dispatchPool);
        long renewMillis = settings.renewInterval().toMillis();
        int active = 0;
        boolean truncated = false;
        boolean suspended = false;
        boolean interrupted = false;

        while (active > 0 || (!truncated && !queue.isEmpty())) {
            while (!truncated && active < parallelism && !queue.isEmpty()) {
                TaskSpec task = queue.poll();
                // A sequential task sees its predecessors' results
                Map<String, TaskResult> visible = sequential ? cursor.state.results() : waveResults;
                if (!conditions.evaluate(task.condition(), cursor.state.context(), visible)) {
                    skipTask(cursor, stage, task);
                    continue;
                }
                TaskDispatcher.DispatchRequest request = dispatchRequest(cursor, stage, task);
                running.add(completion.submit(() -> dispatcher.dispatch(request)));
                active++;
            }
            if (active == 0) {
                break;
            }

            Future<DispatchResult> done;
            try {
                done = completion.poll(renewMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Engine thread interrupted while run {} had {} task(s) in flight", cursor.runId, active);
                cancelAll(running);
                return StageOutcome.ABANDONED;
            }
            if (done == null) {
                // Still waiting: keep the lease alive
                update(cursor, UnaryOperator.identity());
                continue;
            }
            active--;
            running.remove(done);

            DispatchResult result;
            try {
                result = done.get();
            } catch (CancellationException e) {
                log.info("In-flight task of run {} was interrupted; its result is discarded", cursor.runId);
                interrupted = true;
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(running);
                return StageOutcome.ABANDONED;
            } catch (ExecutionException e) {
                cancelAll(running);
                throw new IllegalStateException("Task dispatch failed", e.getCause());
            }

            if (record(cursor, stage, result) && failFast && !truncated) {
                log.warn("Required task {} failed in fail-fast stage {}; draining {} in-flight task(s)",
                    result.taskId(), stage.id(), active);
                truncated = true;
            }
            if (sequential && result.isSuspended() && !truncated) {
                log.info("Task {} suspended; {} later task(s) of stage {} wait for its signal",
                    result.pending().taskId(), queue.size(), stage.id());
                truncated = true;
                suspended = true;
            }
        }

        if (interrupted) {
            return StageOutcome.CANCELLED;
        }
        if (suspended) {
            return StageOutcome.SUSPENDED;
        }
        return truncated ? StageOutcome.FAIL_FAST : StageOutcome.COMPLETED;
    }

    private static Map<String, TaskResult> resultsBefore(RunState state, List<TaskSpec> wave) {
        Map<String, TaskResult> before = new LinkedHashMap<>(state.results());
        wave.forEach(task -> before.remove(task.id()));
        return before;
    }

    /**
     * Persist one dispatch outcome.
     *
     * @return true if a required task failed
     */
    private boolean record(RunCursor cursor, Stage stage, DispatchResult dispatched) {
        if (dispatched.isSuspended()) {
            PendingTask pending = dispatched.pending();
            update(cursor, s -> s.hasResult(pending.taskId()) ? s : s.withPending(pending));
            events.publish(event(RunEventType.TASK_SUSPENDED, cursor).stage(stage.id()).task(pending.taskId())
                .attr("attempt", pending.attempt())
                .attr("waitDeadline", pending.waitDeadline())
                .build());
            return false;
        }

        TaskResult result = dispatched.result();
        update(cursor, s -> s.withResult(result));
        events.publish(event(result.status() == TaskStatus.TIMEOUT
                ? RunEventType.TASK_TIMED_OUT : RunEventType.TASK_COMPLETED, cursor)
            .stage(stage.id())
            .task(result.taskId())
            .attr("status", result.status())
            .attr("severity", result.severity())
            .attr("attempt", result.attempt())
            .attr("durationMs", Duration.between(result.startedAt(), result.completedAt()).toMillis())
            .attr("errorCode", result.errorCode())
            .build());

        return result.status().isFailure() && stage.tasks().stream()
            .filter(t -> t.id().equals(result.taskId()))
            .anyMatch(stage::isTaskRequired);
    }

    private boolean failFastTriggered(RunCursor cursor, Stage stage) {
        if (!stage.effectiveFailFast(cursor.definition.defaults())) {
            return false;
        }
        return stage.tasks().stream()
            .filter(stage::isTaskRequired)
            .map(t -> cursor.state.results().get(t.id()))
            .anyMatch(r -> r != null && r.status().isFailure());
    }

    private void skipStage(RunCursor cursor, Stage stage) {
        Instant now = clock.instant();
        List<String> skipped = stage.tasks().stream()
            .map(TaskSpec::id)
            .filter(id -> !cursor.state.hasResult(id))
            .toList();
        update(cursor, s -> recordSkips(s, skipped, STAGE_CONDITION_REASON, now));

        log.info("Stage {} skipped: condition evaluated false", stage.id());
        events.publish(event(RunEventType.STAGE_SKIPPED, cursor).stage(stage.id()).build());
        publishSkips(cursor, stage.id(), skipped, STAGE_CONDITION_REASON);
    }

    private void skipTask(RunCursor cursor, Stage stage, TaskSpec task) {
        Instant now = clock.instant();
        update(cursor, s -> s.withResult(TaskResult.skipped(s.runId(), task.id(), TASK_CONDITION_REASON, now)));
        log.info("Task {} skipped: condition evaluated false", task.id());
        publishSkips(cursor, stage.id(), List.of(task.id()), TASK_CONDITION_REASON);
    }

    /**
     * Record every unrecorded task of the current and later stages as SKIPPED,
     * then move past the last stage.
     */
    private void skipRemaining(RunCursor cursor) {
        List<Stage> stages = cursor.definition.stages();
        Instant now = clock.instant();
        List<String> skipped = new ArrayList<>();
        for (int i = cursor.state.currentStage(); i < stages.size(); i++) {
            for (TaskSpec task : stages.get(i).tasks()) {
                if (!cursor.state.hasResult(task.id())) {
                    skipped.add(task.id());
                }
            }
        }
        update(cursor, s -> recordSkips(s, skipped, FAIL_FAST_REASON, now).toBuilder()
            .currentStage(stages.size())
            .build());

        log.warn("Fail-fast: {} remaining task(s) not run", skipped.size());
        publishSkips(cursor, null, skipped, FAIL_FAST_REASON);
    }

    private void completeStage(RunCursor cursor, int index, Stage stage) {
        update(cursor, s -> s.toBuilder().currentStage(index + 1).build());
        log.info("Stage {} completed ({}/{})", stage.id(), index + 1, cursor.definition.stages().size());
        events.publish(event(RunEventType.STAGE_COMPLETED, cursor).stage(stage.id()).build());
    }

    private static RunState recordSkips(RunState state, List<String> taskIds, String reason, Instant now) {
        RunState next = state;
        for (String taskId : taskIds) {
            next = next.withResult(TaskResult.skipped(state.runId(), taskId, reason, now));
        }
        return next;
    }

    private void publishSkips(RunCursor cursor, String stageId, List<String> taskIds, String reason) {
        for (String taskId : taskIds) {
            events.publish(event(RunEventType.TASK_SKIPPED, cursor).stage(stageId).task(taskId)
                .attr("reason", reason)
                .build());
        }
    }

    private TaskDispatcher.DispatchRequest dispatchRequest(RunCursor cursor, Stage stage, TaskSpec task) {
        PipelineDefaults defaults = cursor.definition.defaults();
        return new TaskDispatcher.DispatchRequest(
            cursor.runId,
            cursor.definition.id(),
            stage.id(),
            task,
            invocationPayload(cursor.state, task),
            task.effectiveTimeout(defaults),
            task.effectiveRetryPolicy(defaults),
            task.effectiveWaitTimeout(defaults)
        );
    }

    /**
     * Payload sent to a task: the run context, the task's parameters and the
     * results of the tasks it depends on.
     */
    static JsonNode invocationPayload(RunState state, TaskSpec task) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("runId", state.runId());
        payload.put("subjectId", state.context().subjectId());
        payload.set("attributes", state.context().attributes().deepCopy());
        ArrayNode labels = payload.putArray("labels");
        state.context().labels().stream().sorted().forEach(labels::add);
        if (task.parameters() != null) {
            payload.set("parameters", task.parameters().deepCopy());
        }
        ObjectNode dependencies = payload.putObject("dependencies");
        for (String dependency : task.dependsOn()) {
            TaskResult result = state.results().get(dependency);
            if (result != null) {
                ObjectNode node = dependencies.putObject(dependency);
                node.put("status", result.status().name());
                node.put("severity", result.severity().name());
                if (result.payload() != null) {
                    node.set("payload", result.payload().deepCopy());
                }
            }
        }
        return payload;
    }

    // ========== Status Transitions ==========

    /**
     * Record expired waits as TIMEOUT.
     *
     * @return true while any pending task is still waiting for its signal
     */
    private boolean settlePending(RunCursor cursor) {
        Instant now = clock.instant();
        List<PendingTask> expired = cursor.state.pendingTasks().values().stream()
            .filter(p -> p.isExpired(now))
            .toList();
        if (!expired.isEmpty()) {
            update(cursor, s -> {
                RunState next = s;
                for (PendingTask pending : expired) {
                    if (s.pendingTasks().containsKey(pending.taskId())) {
                        next = next.withResult(TaskResult.waitExpired(s.runId(), pending, now));
                    }
                }
                return next;
            });
            for (PendingTask pending : expired) {
                log.warn("Task {} received no signal before {}", pending.taskId(), pending.waitDeadline());
                events.publish(event(RunEventType.TASK_TIMED_OUT, cursor).task(pending.taskId())
                    .attr("status", TaskStatus.TIMEOUT)
                    .attr("attempt", pending.attempt())
                    .attr("durationMs", Duration.between(pending.suspendedAt(), now).toMillis())
                    .attr("errorCode", "WAIT_TIMEOUT")
                    .build());
            }
        }
        return !cursor.state.pendingTasks().isEmpty();
    }

    private void startOrResume(RunCursor cursor) {
        RunStatus status = cursor.state.status();
        if (status == RunStatus.CREATED) {
            update(cursor, s -> s.toBuilder().status(RunStatus.RUNNING).build());
            log.info("Started run of {}", cursor.definition.id());
            events.publish(event(RunEventType.RUN_STARTED, cursor).build());
            return;
        }
        if (status == RunStatus.SUSPENDED) {
            update(cursor, s -> s.toBuilder().status(RunStatus.RUNNING).build());
        }
        log.info("Resuming run at stage {}", cursor.state.currentStage());
        events.publish(event(RunEventType.RUN_RESUMED, cursor)
            .attr("stage", cursor.state.currentStage())
            .build());
    }

    /**
     * Persist SUSPENDED and release the lease, unless every signal arrived in
     * the meantime, in which case the run stays (or becomes) RUNNING.
     */
    private RunState suspend(RunCursor cursor) {
        RunStatus before = cursor.state.status();
        RunState next = update(cursor, s -> s.toBuilder()
            .status(s.pendingTasks().isEmpty() ? RunStatus.RUNNING : RunStatus.SUSPENDED)
            .build());
        if (next.status() != RunStatus.SUSPENDED) {
            log.debug("All signals already received, continuing");
            return next;
        }
        if (before != RunStatus.SUSPENDED) {
            log.info("Run suspended awaiting {}", next.pendingTasks().keySet());
            events.publish(event(RunEventType.RUN_SUSPENDED, cursor)
                .attr("pending", String.join(",", next.pendingTasks().keySet()))
                .build());
        } else {
            log.debug("Run still awaiting {}", next.pendingTasks().keySet());
        }
        return next;
    }

    private RunState cancel(RunCursor cursor) {
        cancelAll(inFlight.get(cursor.runId));
        Instant now = clock.instant();
        RunState cancelled = update(cursor, s -> s.toBuilder()
            .status(RunStatus.CANCELLED)
            .reason(s.cancelReason() != null ? s.cancelReason() : "cancelled")
            .completedAt(now)
            .build());
        log.info("Run cancelled: {}", cancelled.reason());
        events.publish(event(RunEventType.RUN_CANCELLED, cursor)
            .attr("status", RunStatus.CANCELLED)
            .attr("reason", cancelled.reason())
            .build());
        return cancelled;
    }

    private RunState abandon(RunCursor cursor) {
        boolean released = store.leaseRelease(cursor.runId, settings.ownerId());
        log.warn("Abandoned run {} at stage {} (lease released: {})",
            cursor.runId, cursor.state.currentStage(), released);
        return cursor.state;
    }

    private RunState decide(RunCursor cursor) {
        DecisionPolicy policy = cursor.definition.policyOrElse(settings.defaultPolicy());
        AggregatedResult aggregated = aggregator.aggregate(
            cursor.state.results().values(), cursor.definition, policy);
        Decision decision = decisionEngine.decide(aggregated, policy, cursor.state.context());
        RunStatus outcome = decision.admitted() ? RunStatus.ADMITTED : RunStatus.BLOCKED;

        Instant now = clock.instant();
        RunState decided = update(cursor, s -> terminal(s, outcome, decision.reason(), now, cursor.definition)
            .decision(decision)
            .build());

        log.info("Run decided {} ({}): {}", outcome, decision.reasonCode(), decision.reason());
        events.publish(event(RunEventType.RUN_DECIDED, cursor)
            .attr("status", outcome)
            .attr("severity", aggregated.overallSeverity())
            .attr("reasonCode", decision.reasonCode())
            .build());

        if (outcome.requiresCompensation()) {
            return compensate(cursor);
        }
        return decided;
    }

    private RunState fail(RunCursor cursor, String reason) {
        cancelAll(inFlight.get(cursor.runId));
        Instant now = clock.instant();
        try {
            update(cursor, s -> terminal(s, RunStatus.FAILED, reason, now, cursor.definition).build());
        } catch (RuntimeException e) {
            log.error("Could not record failure of run {}: {}", cursor.runId, reason, e);
            return cursor.state;
        }

        log.error("Run failed: {}", reason);
        events.publish(event(RunEventType.RUN_FAILED, cursor)
            .attr("status", RunStatus.FAILED)
            .attr("reason", reason)
            .build());
        return compensate(cursor);
    }

    private RunState compensate(RunCursor cursor) {
        if (cursor.definition == null) {
            return cursor.state;
        }
        try {
            cursor.state = compensationHandler.compensate(cursor.state, cursor.definition);
        } catch (RuntimeException e) {
            log.error("Compensation outcome of run {} could not be recorded; it will be replayed", cursor.runId, e);
        }
        return cursor.state;
    }

    /**
     * Terminal transition with PENDING records for every declared compensation
     * action, written in the same update as the status.
     */
    private static RunState.Builder terminal(RunState state, RunStatus status, String reason, Instant now,
                                             PipelineDefinition definition) {
        RunState next = state;
        if (status.requiresCompensation() && definition != null) {
            for (CompensationActionSpec action : definition.compensationActions()) {
                boolean known = state.compensationActions().stream()
                    .anyMatch(r -> r.actionId().equals(action.id()));
                if (!known) {
                    next = next.withCompensation(CompensationRecord.pending(action));
                }
            }
        }
        return next.toBuilder()
            .status(status)
            .reason(reason)
            .completedAt(now);
    }

    // ========== Helper Methods ==========

    /**
     * Apply a change through a conditional write, reloading and reapplying on
     * conflict. The lease is renewed with every write, and dropped when the
     * run becomes terminal or suspended.
     */
    private RunState update(RunCursor cursor, UnaryOperator<RunState> change) {
        RunState base = cursor.state;
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            ensureOwned(base);
            Instant now = clock.instant();
            RunState changed = change.apply(base);
            boolean releases = changed.isTerminal() || changed.status() == RunStatus.SUSPENDED;
            RunState next = changed.toBuilder()
                .lease(releases ? null : base.lease().renew(now, settings.leaseDuration()))
                .updatedAt(now)
                .build();
            try {
                cursor.state = store.conditionalPut(next, base.version());
                return cursor.state;
            } catch (StateConflictException e) {
                log.debug("Write conflict on run {} (attempt {}), reloading", cursor.runId, attempt);
                base = refresh(cursor);
            }
        }
        throw new StateConflictException(cursor.runId, MAX_WRITE_ATTEMPTS);
    }

    private RunState refresh(RunCursor cursor) {
        cursor.state = store.get(cursor.runId)
            .orElseThrow(() -> new NotFoundException("Run", cursor.runId));
        ensureOwned(cursor.state);
        return cursor.state;
    }

    private void ensureOwned(RunState state) {
        RunLease lease = state.lease();
        if (lease == null || !lease.isHeldBy(settings.ownerId())) {
            throw new LeaseDeniedException(state.runId(), lease != null ? lease.ownerId() : "nobody");
        }
    }

    private RunEvent.Builder event(RunEventType type, RunCursor cursor) {
        return RunEvent.builder(type, cursor.runId, clock.instant())
            .definition(cursor.state.definitionRef());
    }

    private static void cancelAll(Set<Future<?>> futures) {
        if (futures != null) {
            futures.forEach(f -> f.cancel(true));
        }
    }

    private enum StageOutcome {
        COMPLETED,
        FAIL_FAST,
        SUSPENDED,
        CANCELLED,
        ABANDONED
    }

    /**
     * Latest known state of the run being driven.
     */
    private static final class RunCursor {
        private final String runId;
        private RunState state;
        private PipelineDefinition definition;

        private RunCursor(RunState state) {
            this.runId = state.runId();
            this.state = state;
        }
    }
}

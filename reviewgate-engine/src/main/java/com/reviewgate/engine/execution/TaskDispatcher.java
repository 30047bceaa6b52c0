package com.reviewgate.engine.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.reviewgate.core.exception.TaskInvocationException;
import com.reviewgate.core.invocation.TaskInvocation;
import com.reviewgate.core.invocation.TaskInvoker;
import com.reviewgate.core.invocation.TaskOutcome;
import com.reviewgate.core.model.PendingTask;
import com.reviewgate.core.model.RetryPolicy;
import com.reviewgate.core.model.Severity;
import com.reviewgate.core.model.TaskResult;
import com.reviewgate.core.model.TaskSpec;
import com.reviewgate.core.model.TaskStatus;
import com.reviewgate.engine.events.RunEvent;
import com.reviewgate.engine.events.RunEventPublisher;
import com.reviewgate.engine.events.RunEventType;
import com.reviewgate.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Invokes a single task with timeout and retry.
 *
 * Per attempt:
 * - the call runs on the invocation pool and is cancelled when it exceeds its timeout
 * - a timeout or a retryable {@link TaskInvocationException} is retried with
 *   exponential backoff while the policy allows it
 * - a non-retryable error fails immediately
 *
 * The invocation pool must not be the pool the dispatch itself runs on: a
 * dispatch thread blocks on its invocation.
 *
 * Attempts are numbered from 1 for every dispatch, so a task re-dispatched
 * after a crash reuses the same idempotency keys.
 */
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    public static final String INTERRUPTED = "INTERRUPTED";
    public static final String INVOKER_ERROR = "INVOKER_ERROR";

    private final TaskInvoker invoker;
    private final ExecutorService invocationPool;
    private final BackoffSleeper sleeper;
    private final RunEventPublisher events;
    private final Clock clock;

    public TaskDispatcher(TaskInvoker invoker, ExecutorService invocationPool, BackoffSleeper sleeper,
                          RunEventPublisher events, Clock clock) {
        this.invoker = invoker;
        this.invocationPool = invocationPool;
        this.sleeper = sleeper;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Dispatch one task to completion or suspension.
     *
     * @param request What to invoke and how
     * @return The recorded result or the pending suspension
     */
    public DispatchResult dispatch(DispatchRequest request) {
        RetryPolicy policy = request.retryPolicy();
        Instant startedAt = clock.instant();
        int attempt = 1;

        while (true) {
            String key = TaskResult.idempotencyKey(request.runId(), request.task().id(), attempt);
            try (var ctx = LoggingContext.forTask(request.runId(), request.stageId(), request.task().id(), attempt)) {
                publish(RunEventType.TASK_STARTED, request, attempt, null);

                TaskInvocation invocation = new TaskInvocation(
                    request.runId(), request.task().id(), request.task().taskRef(),
                    attempt, key, request.payload(), request.timeout()
                );

                String errorCode;
                String message;
                boolean retryable;
                try {
                    TaskOutcome outcome = invokeWithTimeout(invocation);
                    return toDispatchResult(request, outcome, attempt, key, startedAt);
                } catch (TimeoutException e) {
                    errorCode = TaskInvocationException.TIMEOUT;
                    message = "No answer within " + request.timeout();
                    retryable = true;
                } catch (TaskInvocationException e) {
                    errorCode = e.getErrorCode();
                    message = e.getMessage();
                    retryable = e.isRetryable();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Dispatch of {} interrupted", request.task().id());
                    return DispatchResult.completed(failure(request, TaskStatus.FAILURE, attempt, key,
                        startedAt, INTERRUPTED, "Invocation interrupted"));
                } catch (RuntimeException e) {
                    log.error("Invoker raised an unexpected error for {}", request.task().id(), e);
                    errorCode = INVOKER_ERROR;
                    message = e.toString();
                    retryable = false;
                }

                TaskStatus finalStatus = TaskInvocationException.TIMEOUT.equals(errorCode)
                    ? TaskStatus.TIMEOUT : TaskStatus.FAILURE;
                if (retryable && policy.shouldRetry(errorCode) && policy.hasMoreAttempts(attempt)) {
                    Duration backoff = policy.computeBackoff(attempt);
                    log.warn("Attempt {} of {} failed with {}: {}; retrying in {}ms",
                        attempt, request.task().id(), errorCode, message, backoff.toMillis());
                    publish(RunEventType.TASK_RETRIED, request, attempt, errorCode);
                    try {
                        sleeper.sleep(backoff);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return DispatchResult.completed(failure(request, finalStatus, attempt, key,
                            startedAt, errorCode, message));
                    }
                    attempt++;
                    continue;
                }

                log.warn("Task {} gave up after attempt {} with {}: {}",
                    request.task().id(), attempt, errorCode, message);
                return DispatchResult.completed(failure(request, finalStatus, attempt, key,
                    startedAt, errorCode, message));
            }
        }
    }

    private TaskOutcome invokeWithTimeout(TaskInvocation invocation)
            throws TaskInvocationException, TimeoutException, InterruptedException {
        Future<TaskOutcome> future = invocationPool.submit(() -> invoker.invoke(invocation));
        try {
            return future.get(invocation.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TaskInvocationException) {
                throw (TaskInvocationException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Invoker failed", cause);
        }
    }

    private DispatchResult toDispatchResult(DispatchRequest request, TaskOutcome outcome, int attempt,
                                            String key, Instant startedAt) {
        Instant now = clock.instant();
        if (outcome == null) {
            return DispatchResult.completed(failure(request, TaskStatus.FAILURE, attempt, key, startedAt,
                INVOKER_ERROR, "Invoker returned no outcome"));
        }
        if (outcome.suspended()) {
            PendingTask pending = new PendingTask(request.task().id(), attempt, key, now,
                now.plus(request.waitTimeout()));
            log.info("Task {} suspended until {}", request.task().id(), pending.waitDeadline());
            return DispatchResult.suspended(pending);
        }
        TaskStatus status = outcome.status() != null ? outcome.status() : TaskStatus.SUCCESS;
        Severity severity = outcome.severity() != null ? outcome.severity() : Severity.NONE;
        TaskResult result = new TaskResult(
            request.task().id(), status, severity, outcome.payload(),
            startedAt, now, attempt, attempt - 1, key, null, null
        );
        log.debug("Task {} completed with {} / {}", request.task().id(), status, severity);
        return DispatchResult.completed(result);
    }

    private TaskResult failure(DispatchRequest request, TaskStatus status, int attempt, String key,
                               Instant startedAt, String errorCode, String message) {
        return new TaskResult(
            request.task().id(), status, Severity.NONE, null,
            startedAt, clock.instant(), attempt, attempt - 1, key, errorCode, message
        );
    }

    private void publish(RunEventType type, DispatchRequest request, int attempt, String errorCode) {
        events.publish(RunEvent.builder(type, request.runId(), clock.instant())
            .definition(request.definitionRef())
            .stage(request.stageId())
            .task(request.task().id())
            .attr("attempt", attempt)
            .attr("errorCode", errorCode)
            .build());
    }

    /**
     * Everything the dispatcher needs to invoke one task.
     */
    public record DispatchRequest(
        String runId,
        String definitionRef,
        String stageId,
        TaskSpec task,
        JsonNode payload,
        Duration timeout,
        RetryPolicy retryPolicy,
        Duration waitTimeout
    ) {
    }
}

package com.reviewgate.engine.execution;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.reviewgate.core.exception.TaskInvocationException;
import com.reviewgate.core.invocation.TaskInvocation;
import com.reviewgate.core.invocation.TaskInvoker;
import com.reviewgate.core.invocation.TaskOutcome;
import com.reviewgate.core.model.RetryPolicy;
import com.reviewgate.core.model.Severity;
import com.reviewgate.core.model.TaskResult;
import com.reviewgate.core.model.TaskSpec;
import com.reviewgate.core.model.TaskStatus;
import com.reviewgate.engine.events.RunEvent;
import com.reviewgate.engine.events.RunEventPublisher;
import com.reviewgate.engine.events.RunEventType;
import com.reviewgate.engine.execution.TaskDispatcher.DispatchRequest;
import com.reviewgate.engine.test.MutableClock;
import com.reviewgate.engine.test.ScriptedTaskInvoker;
import com.reviewgate.engine.test.ScriptedTaskInvoker.Step;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TaskDispatcherTest {

    private static final Instant START = Instant.parse("2026-03-02T09:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final List<Duration> backoffs = new CopyOnWriteArrayList<>();
    private final List<RunEvent> published = new CopyOnWriteArrayList<>();
    private ScriptedTaskInvoker invoker;
    private ExecutorService pool;
    private TaskDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        invoker = new ScriptedTaskInvoker();
        pool = Executors.newCachedThreadPool();
        dispatcher = newDispatcher(invoker);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
    }

    private TaskDispatcher newDispatcher(TaskInvoker taskInvoker) {
        RunEventPublisher events = new RunEventPublisher();
        events.register(published::add);
        return new TaskDispatcher(taskInvoker, pool, backoffs::add, events, clock);
    }

    private static DispatchRequest request(String taskId, Duration timeout, RetryPolicy policy) {
        return new DispatchRequest("run-1", "review:1", "analysis", TaskSpec.builder(taskId).build(),
            JsonNodeFactory.instance.objectNode().put("subjectId", "PR-1"), timeout, policy, Duration.ofHours(1));
    }

    private static RetryPolicy threeAttempts() {
        return RetryPolicy.builder()
            .maxAttempts(3)
            .initialBackoff(Duration.ofMillis(100))
            .jitterFactor(0.0)
            .build();
    }

    private List<RunEventType> eventTypes() {
        return published.stream().map(RunEvent::type).toList();
    }

    // ========== Outcomes ==========

    @Test
    void dispatch_success_shouldRecordOutcomeOnFirstAttempt() {
        invoker.on("security", Step.withSeverity(Severity.MEDIUM,
            JsonNodeFactory.instance.objectNode().put("findings", 2)));

        DispatchResult dispatched = dispatcher.dispatch(request("security", Duration.ofSeconds(5), threeAttempts()));

        assertFalse(dispatched.isSuspended());
        TaskResult result = dispatched.result();
        assertEquals(TaskStatus.SUCCESS, result.status());
        assertEquals(Severity.MEDIUM, result.severity());
        assertEquals(2, result.payload().get("findings").asInt());
        assertEquals(1, result.attempt());
        assertEquals(0, result.retryCount());
        assertEquals("run-1:security:1", result.idempotencyKey());
        assertEquals(START, result.startedAt());

        TaskInvocation invocation = invoker.invocationsOf("security").get(0);
        assertEquals("security", invocation.taskRef());
        assertEquals("PR-1", invocation.payload().get("subjectId").asText());
        assertEquals(Duration.ofSeconds(5), invocation.timeout());
        assertThat(backoffs).isEmpty();
        assertEquals(List.of(RunEventType.TASK_STARTED), eventTypes());
    }

    @Test
    void dispatch_failureOutcome_shouldNotRetry() {
        invoker.on("architect", Step.returning(TaskOutcome.failure(Severity.HIGH, null)));

        TaskResult result = dispatcher.dispatch(request("architect", Duration.ofSeconds(5), threeAttempts())).result();

        assertEquals(TaskStatus.FAILURE, result.status());
        assertEquals(Severity.HIGH, result.severity());
        assertEquals(1, invoker.invocationCount("architect"));
    }

    @Test
    void dispatch_suspendedOutcome_shouldReturnPendingWithWaitDeadline() {
        invoker.on("signoff", Step.returning(TaskOutcome.suspendedOutcome()));

        DispatchResult dispatched = dispatcher.dispatch(request("signoff", Duration.ofSeconds(5), threeAttempts()));

        assertTrue(dispatched.isSuspended());
        assertNull(dispatched.result());
        assertEquals("run-1:signoff:1", dispatched.pending().idempotencyKey());
        assertEquals(START.plus(Duration.ofHours(1)), dispatched.pending().waitDeadline());
    }

    @Test
    void dispatch_nullOutcome_shouldFailWithInvokerError() throws Exception {
        TaskInvoker silent = mock(TaskInvoker.class);
        when(silent.invoke(any())).thenReturn(null);

        TaskResult result = newDispatcher(silent)
            .dispatch(request("lint", Duration.ofSeconds(5), threeAttempts())).result();

        assertEquals(TaskStatus.FAILURE, result.status());
        assertEquals(TaskDispatcher.INVOKER_ERROR, result.errorCode());
    }

    // ========== Retries ==========

    @Test
    void dispatch_transientErrors_shouldRetryWithBackoffAndFreshKeys() {
        TaskInvocationException transientError = TaskInvocationException.transientFailure(
            TaskInvocationException.TRANSPORT, "connection reset", null);
        invoker.on("code-quality", Step.failing(transientError), Step.failing(transientError),
            Step.returning(TaskOutcome.success()));

        TaskResult result = dispatcher.dispatch(request("code-quality", Duration.ofSeconds(5), threeAttempts())).result();

        assertEquals(TaskStatus.SUCCESS, result.status());
        assertEquals(3, result.attempt());
        assertEquals(2, result.retryCount());
        assertThat(invoker.invocationsOf("code-quality")).extracting(TaskInvocation::idempotencyKey)
            .containsExactly("run-1:code-quality:1", "run-1:code-quality:2", "run-1:code-quality:3");
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), backoffs);
        assertThat(eventTypes()).containsExactly(
            RunEventType.TASK_STARTED, RunEventType.TASK_RETRIED,
            RunEventType.TASK_STARTED, RunEventType.TASK_RETRIED,
            RunEventType.TASK_STARTED);
    }

    @Test
    void dispatch_retriesExhausted_shouldRecordLastError() {
        invoker.on("code-quality", Step.failing(TaskInvocationException.transientFailure(
            TaskInvocationException.TRANSPORT, "503 from reviewer", null)));

        TaskResult result = dispatcher.dispatch(request("code-quality", Duration.ofSeconds(5), threeAttempts())).result();

        assertEquals(TaskStatus.FAILURE, result.status());
        assertEquals(TaskInvocationException.TRANSPORT, result.errorCode());
        assertEquals("503 from reviewer", result.message());
        assertEquals(3, result.attempt());
        assertEquals(3, invoker.invocationCount("code-quality"));
    }

    @Test
    void dispatch_permanentError_shouldFailWithoutRetry() {
        invoker.on("jira-integration", Step.failing(TaskInvocationException.permanent(
            TaskInvocationException.REJECTED, "400 bad request")));

        TaskResult result = dispatcher.dispatch(request("jira-integration", Duration.ofSeconds(5), threeAttempts())).result();

        assertEquals(TaskInvocationException.REJECTED, result.errorCode());
        assertEquals(1, invoker.invocationCount("jira-integration"));
        assertThat(backoffs).isEmpty();
    }

    @Test
    void dispatch_errorListedAsNonRetryable_shouldFailWithoutRetry() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(3)
            .initialBackoff(Duration.ofMillis(100))
            .nonRetryableErrors(Set.of("QUOTA_EXHAUSTED"))
            .build();
        invoker.on("security", Step.failing(new TaskInvocationException("QUOTA_EXHAUSTED", "quota")));

        TaskResult result = dispatcher.dispatch(request("security", Duration.ofSeconds(5), policy)).result();

        assertEquals("QUOTA_EXHAUSTED", result.errorCode());
        assertEquals(1, invoker.invocationCount("security"));
    }

    @Test
    void dispatch_invokerCrash_shouldFailWithoutRetry() {
        invoker.on("lint", Step.crashing(new IllegalStateException("bug in adapter")));

        TaskResult result = dispatcher.dispatch(request("lint", Duration.ofSeconds(5), threeAttempts())).result();

        assertEquals(TaskStatus.FAILURE, result.status());
        assertEquals(TaskDispatcher.INVOKER_ERROR, result.errorCode());
        assertThat(result.message()).contains("bug in adapter");
        assertEquals(1, invoker.invocationCount("lint"));
    }

    // ========== Timeouts ==========

    @Test
    void dispatch_slowInvocation_shouldTimeOutAndRetry() {
        invoker.on("pattern-matching", Step.hanging(Duration.ofSeconds(5)), Step.returning(TaskOutcome.success()));

        TaskResult result = dispatcher.dispatch(
            request("pattern-matching", Duration.ofMillis(100), threeAttempts())).result();

        assertEquals(TaskStatus.SUCCESS, result.status());
        assertEquals(2, result.attempt());
        assertEquals(List.of(Duration.ofMillis(100)), backoffs);
    }

    @Test
    void dispatch_timeoutWithoutRetries_shouldRecordTimeout() {
        invoker.on("pattern-matching", Step.hanging(Duration.ofSeconds(5)));

        TaskResult result = dispatcher.dispatch(
            request("pattern-matching", Duration.ofMillis(100), RetryPolicy.noRetry())).result();

        assertEquals(TaskStatus.TIMEOUT, result.status());
        assertEquals(TaskInvocationException.TIMEOUT, result.errorCode());
        assertEquals(Severity.NONE, result.severity());
    }
}

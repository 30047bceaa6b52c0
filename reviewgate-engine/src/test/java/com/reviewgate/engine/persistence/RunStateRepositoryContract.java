package com.reviewgate.engine.persistence;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.reviewgate.core.exception.InvalidStateTransitionException;
import com.reviewgate.core.exception.LeaseDeniedException;
import com.reviewgate.core.exception.NotFoundException;
import com.reviewgate.core.exception.StateConflictException;
import com.reviewgate.core.model.CompensationActionSpec;
import com.reviewgate.core.model.CompensationRecord;
import com.reviewgate.core.model.Decision;
import com.reviewgate.core.model.PendingTask;
import com.reviewgate.core.model.PipelineDefinition;
import com.reviewgate.core.model.ReasonCode;
import com.reviewgate.core.model.RunContext;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.model.RunStatus;
import com.reviewgate.core.model.Severity;
import com.reviewgate.core.model.Stage;
import com.reviewgate.core.model.TaskResult;
import com.reviewgate.core.model.TaskSpec;
import com.reviewgate.core.model.TaskStatus;
import com.reviewgate.core.repository.RunStateRepository;
import com.reviewgate.engine.test.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Behavior every {@link RunStateRepository} must share. Subclasses supply the store.
 */
public abstract class RunStateRepositoryContract {

    protected static final Instant START = Instant.parse("2026-03-02T09:00:00Z");
    protected static final Duration LEASE = Duration.ofSeconds(30);

    protected static final PipelineDefinition DEFINITION = PipelineDefinition.builder("peer-review", 2)
        .stage(Stage.sequential("review", TaskSpec.builder("architect").required(true).build()))
        .compensation(new CompensationActionSpec("open-ticket", "OPEN_TICKET", null))
        .build();

    protected MutableClock clock;
    protected RunStateRepository store;

    protected abstract RunStateRepository createStore(Clock clock);

    @BeforeEach
    void setUpStore() {
        clock = new MutableClock(START);
        store = createStore(clock);
    }

    protected RunState newRun(String runId, String subjectId) {
        RunContext context = new RunContext(subjectId,
            JsonNodeFactory.instance.objectNode().put("repository", "payments-service"),
            Set.of("backend"));
        return RunState.create(runId, DEFINITION, context, clock.instant(), clock.instant().plus(Duration.ofHours(2)));
    }

    private RunState running(RunState stored) {
        return store.conditionalPut(stored.toBuilder()
            .status(RunStatus.RUNNING)
            .updatedAt(clock.instant())
            .build(), stored.version());
    }

    private RunState blocked(RunState runningState) {
        TaskResult failed = new TaskResult("architect", TaskStatus.FAILURE, Severity.HIGH, null,
            clock.instant(), clock.instant(), 1, 0, TaskResult.idempotencyKey(runningState.runId(), "architect", 1),
            null, "design drift");
        RunState next = runningState.withResult(failed).toBuilder()
            .status(RunStatus.BLOCKED)
            .currentStage(1)
            .decision(Decision.block(ReasonCode.REQUIRED_TASK_FAILED, "required task(s) failed: architect",
                List.of("required-failed:architect")))
            .reason("required task(s) failed: architect")
            .compensationActions(List.of(CompensationRecord.pending(DEFINITION.compensationActions().get(0))))
            .lease(null)
            .updatedAt(clock.instant())
            .completedAt(clock.instant())
            .build();
        return store.conditionalPut(next, runningState.version());
    }

    // ========== Create and Read ==========

    @Test
    void create_shouldStoreVersionOneAndRoundTrip() {
        RunState stored = store.create(newRun("run-1", "PR-1"));

        assertEquals(1L, stored.version());
        RunState loaded = store.get("run-1").orElseThrow();
        assertEquals(1L, loaded.version());
        assertEquals(RunStatus.CREATED, loaded.status());
        assertEquals("peer-review:2", loaded.definitionRef());
        assertEquals("PR-1", loaded.context().subjectId());
        assertEquals("payments-service", loaded.context().attributes().get("repository").asText());
        assertEquals(Set.of("backend"), loaded.context().labels());
        assertEquals(START, loaded.createdAt());
    }

    @Test
    void create_duplicateRunId_shouldConflict() {
        store.create(newRun("run-1", "PR-1"));

        assertThatThrownBy(() -> store.create(newRun("run-1", "PR-1")))
            .isInstanceOf(StateConflictException.class);
    }

    @Test
    void get_unknownRun_shouldBeEmpty() {
        assertTrue(store.get("missing").isEmpty());
    }

    // ========== Conditional Writes ==========

    @Test
    void conditionalPut_matchingVersion_shouldIncrementVersion() {
        RunState stored = store.create(newRun("run-1", "PR-1"));
        PendingTask pending = new PendingTask("architect", 1, "run-1:architect:1", START, START.plus(Duration.ofHours(1)));

        RunState updated = store.conditionalPut(stored.toBuilder().status(RunStatus.RUNNING).build()
            .withPending(pending), 1L);

        assertEquals(2L, updated.version());
        RunState loaded = store.get("run-1").orElseThrow();
        assertEquals(RunStatus.RUNNING, loaded.status());
        assertEquals(pending, loaded.pendingTasks().get("architect"));
    }

    @Test
    void conditionalPut_staleVersion_shouldConflictAndKeepStoredState() {
        RunState stored = store.create(newRun("run-1", "PR-1"));
        running(stored);

        assertThatThrownBy(() -> store.conditionalPut(stored.toBuilder().reason("stale").build(), 1L))
            .isInstanceOf(StateConflictException.class);
        assertNull(store.get("run-1").orElseThrow().reason());
    }

    @Test
    void conditionalPut_unknownRun_shouldBeNotFound() {
        assertThatThrownBy(() -> store.conditionalPut(newRun("ghost", "PR-1"), 1L))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void conditionalPut_illegalTransition_shouldBeRejected() {
        RunState stored = store.create(newRun("run-1", "PR-1"));

        assertThatThrownBy(() -> store.conditionalPut(stored.toBuilder().status(RunStatus.ADMITTED).build(), 1L))
            .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void conditionalPut_stageRegression_shouldBeRejected() {
        RunState advanced = store.conditionalPut(
            running(store.create(newRun("run-1", "PR-1"))).toBuilder().currentStage(1).build(), 2L);

        assertThatThrownBy(() -> store.conditionalPut(advanced.toBuilder().currentStage(0).build(), 3L))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void conditionalPut_terminalRun_shouldOnlyAcceptCompensationUpdates() {
        RunState terminal = blocked(running(store.create(newRun("run-1", "PR-1"))));

        CompensationRecord executed = terminal.compensationActions().get(0).executed(clock.instant());
        RunState compensated = store.conditionalPut(terminal.withCompensation(executed), terminal.version());
        assertTrue(compensated.compensationActions().get(0).isDone());

        TaskResult rewritten = new TaskResult("architect", TaskStatus.SUCCESS, Severity.NONE, null,
            START, START, 2, 1, "run-1:architect:2", null, null);
        RunState tampered = compensated.toBuilder()
            .results(Map.of("architect", rewritten))
            .build();
        assertThatThrownBy(() -> store.conditionalPut(tampered, compensated.version()))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> store.conditionalPut(
                compensated.toBuilder().status(RunStatus.RUNNING).build(), compensated.version()))
            .isInstanceOf(InvalidStateTransitionException.class);
    }

    // ========== Leases ==========

    @Test
    void leaseClaim_unownedRun_shouldGrantLease() {
        store.create(newRun("run-1", "PR-1"));

        RunState claimed = store.leaseClaim("run-1", "engine-1", LEASE);

        assertEquals("engine-1", claimed.lease().ownerId());
        assertEquals(START.plus(LEASE), claimed.lease().expiresAt());
        assertEquals(2L, claimed.version());
        assertTrue(store.get("run-1").orElseThrow().isLeased(clock.instant()));
    }

    @Test
    void leaseClaim_sameOwner_shouldRenew() {
        store.create(newRun("run-1", "PR-1"));
        store.leaseClaim("run-1", "engine-1", LEASE);
        clock.advance(Duration.ofSeconds(10));

        RunState renewed = store.leaseClaim("run-1", "engine-1", LEASE);

        assertEquals(START, renewed.lease().acquiredAt());
        assertEquals(START.plus(Duration.ofSeconds(40)), renewed.lease().expiresAt());
    }

    @Test
    void leaseClaim_activeLeaseOfAnotherOwner_shouldBeDenied() {
        store.create(newRun("run-1", "PR-1"));
        store.leaseClaim("run-1", "engine-1", LEASE);

        assertThatThrownBy(() -> store.leaseClaim("run-1", "engine-2", LEASE))
            .isInstanceOf(LeaseDeniedException.class);
    }

    @Test
    void leaseClaim_expiredLease_shouldBeTakenOver() {
        store.create(newRun("run-1", "PR-1"));
        store.leaseClaim("run-1", "engine-1", LEASE);
        clock.advance(LEASE.plusSeconds(1));

        RunState claimed = store.leaseClaim("run-1", "engine-2", LEASE);

        assertEquals("engine-2", claimed.lease().ownerId());
    }

    @Test
    void leaseClaim_terminalOrUnknownRun_shouldBeRejected() {
        blocked(running(store.create(newRun("run-1", "PR-1"))));

        assertThatThrownBy(() -> store.leaseClaim("run-1", "engine-1", LEASE))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> store.leaseClaim("ghost", "engine-1", LEASE))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void leaseRelease_shouldOnlyReleaseOwnLease() {
        store.create(newRun("run-1", "PR-1"));
        store.leaseClaim("run-1", "engine-1", LEASE);

        assertFalse(store.leaseRelease("run-1", "engine-2"));
        assertTrue(store.leaseRelease("run-1", "engine-1"));
        assertNull(store.get("run-1").orElseThrow().lease());
        assertFalse(store.leaseRelease("run-1", "engine-1"));
        assertFalse(store.leaseRelease("ghost", "engine-1"));
    }

    // ========== Scans ==========

    @Test
    void listResumable_shouldReturnUnownedNonTerminalRunsOldestFirst() {
        store.create(newRun("run-old", "PR-1"));
        clock.advance(Duration.ofMinutes(1));
        store.create(newRun("run-leased", "PR-2"));
        store.leaseClaim("run-leased", "engine-1", LEASE);
        store.create(newRun("run-new", "PR-3"));
        blocked(running(store.create(newRun("run-done", "PR-4"))));

        assertThat(store.listResumable(10)).extracting(RunState::runId)
            .containsExactly("run-old", "run-new");
        assertThat(store.listResumable(1)).extracting(RunState::runId)
            .containsExactly("run-old");

        clock.advance(LEASE);
        assertThat(store.listResumable(10)).extracting(RunState::runId)
            .containsExactlyInAnyOrder("run-old", "run-leased", "run-new");
    }

    @Test
    void findActiveBySubject_shouldMatchPipelineAndSubject() {
        store.create(newRun("run-1", "PR-1"));
        clock.advance(Duration.ofSeconds(1));
        store.create(newRun("run-2", "PR-1"));
        store.create(newRun("run-3", "PR-2"));
        blocked(running(store.create(newRun("run-4", "PR-1"))));

        assertThat(store.findActiveBySubject("peer-review", "PR-1")).extracting(RunState::runId)
            .containsExactly("run-1", "run-2");
        assertThat(store.findActiveBySubject("other-pipeline", "PR-1")).isEmpty();
    }

    @Test
    void listTerminalWithPendingCompensation_shouldSkipCompletedCompensation() {
        RunState pending = blocked(running(store.create(newRun("run-1", "PR-1"))));
        RunState done = blocked(running(store.create(newRun("run-2", "PR-2"))));
        store.conditionalPut(done.withCompensation(done.compensationActions().get(0).executed(clock.instant())),
            done.version());
        store.create(newRun("run-3", "PR-3"));

        assertThat(store.listTerminalWithPendingCompensation(10)).extracting(RunState::runId)
            .containsExactly(pending.runId());
    }

    @Test
    void deleteTerminalBefore_shouldOnlyDeleteOldTerminalRuns() {
        blocked(running(store.create(newRun("run-old", "PR-1"))));
        store.create(newRun("run-active", "PR-2"));
        clock.advance(Duration.ofDays(10));
        blocked(running(store.create(newRun("run-recent", "PR-3"))));

        int deleted = store.deleteTerminalBefore(START.plus(Duration.ofDays(5)));

        assertEquals(1, deleted);
        assertTrue(store.get("run-old").isEmpty());
        assertTrue(store.get("run-active").isPresent());
        assertTrue(store.get("run-recent").isPresent());
    }

    // ========== Unreadable Records ==========

    @Test
    void markCorrupt_activeRun_shouldSettleItWithoutTouchingOthers() {
        store.create(newRun("run-1", "PR-1"));
        store.leaseClaim("run-1", "engine-1", LEASE);
        store.create(newRun("run-2", "PR-1"));

        assertTrue(store.markCorrupt("run-1", "unsupported schema version 7"));

        clock.advance(LEASE);
        assertThat(store.listResumable(10)).extracting(RunState::runId).containsExactly("run-2");
        assertThat(store.findActiveBySubject("peer-review", "PR-1")).extracting(RunState::runId)
            .containsExactly("run-2");
        assertFalse(store.markCorrupt("run-1", "unsupported schema version 7"));
        assertFalse(store.markCorrupt("run-unknown", "unreadable document"));

        assertEquals(1, store.deleteTerminalBefore(clock.instant()));
        assertTrue(store.get("run-2").isPresent());
    }
}

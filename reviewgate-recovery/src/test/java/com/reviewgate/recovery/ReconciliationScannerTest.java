package com.reviewgate.recovery;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.reviewgate.core.invocation.TaskOutcome;
import com.reviewgate.core.model.CompensationActionSpec;
import com.reviewgate.core.model.CompensationStatus;
import com.reviewgate.core.model.PipelineDefinition;
import com.reviewgate.core.model.RunContext;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.model.RunStatus;
import com.reviewgate.core.model.Severity;
import com.reviewgate.core.model.Stage;
import com.reviewgate.core.model.TaskSpec;
import com.reviewgate.core.model.TaskStatus;
import com.reviewgate.engine.compensation.CompensationHandler;
import com.reviewgate.engine.events.RunEvent;
import com.reviewgate.engine.events.RunEventType;
import com.reviewgate.engine.test.EngineFixture;
import com.reviewgate.engine.test.ScriptedTaskInvoker.Step;
import com.reviewgate.recovery.ReconciliationScanner.ScanReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconciliationScannerTest {

    private static final Duration GRACE = Duration.ofMinutes(1);
    private static final Duration RETENTION = Duration.ofDays(7);

    private EngineFixture fixture;
    private ReconciliationScanner scanner;

    @BeforeEach
    void setUp() {
        fixture = EngineFixture.create();
        CompensationHandler compensation = new CompensationHandler(
            fixture.gateway(), fixture.store(), fixture.publisher(), fixture.clock());
        scanner = new ReconciliationScanner(
            fixture.store(), fixture.definitions(), fixture.engine(), compensation, fixture.publisher(),
            Runnable::run, new ReconciliationSettings(Duration.ofHours(1), GRACE, RETENTION, 50),
            fixture.clock());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        scanner.stop();
        fixture.close();
    }

    private PipelineDefinition lintPipeline() {
        return fixture.register(PipelineDefinition.builder("review", 1)
            .stage(Stage.sequential("lint", TaskSpec.builder("code-quality").required(true).build()))
            .compensation(new CompensationActionSpec("open-ticket", "OPEN_TICKET",
                JsonNodeFactory.instance.objectNode().put("project", "REVIEW")))
            .build());
    }

    private void signoffPipeline(Duration waitTimeout) {
        fixture.register(PipelineDefinition.builder("signoff", 1)
            .stage(Stage.sequential("approval",
                TaskSpec.builder("architect-signoff").waitTimeout(waitTimeout).build()))
            .stage(Stage.sequential("tracking", TaskSpec.builder("jira-integration").build()))
            .build());
        fixture.invoker().on("architect-signoff", Step.returning(TaskOutcome.suspendedOutcome()));
    }

    // ========== Resumption ==========

    @Test
    void scanOnce_nothingToDo_shouldReportEmptyPass() {
        ScanReport report = scanner.scanOnce();

        assertTrue(report.isEmpty());
    }

    @Test
    @DisplayName("A run whose owner crashed is resumed once its lease expires")
    void scanOnce_expiredLease_shouldResumeRun() {
        PipelineDefinition definition = lintPipeline();
        fixture.seedRun("run-crashed", definition, RunContext.of("PR-201"));
        fixture.store().leaseClaim("run-crashed", "engine-crashed", EngineFixture.LEASE);

        ScanReport beforeExpiry = scanner.scanOnce();
        assertEquals(0, beforeExpiry.resumed());
        assertEquals(RunStatus.CREATED, fixture.statusOf("run-crashed"));

        fixture.clock().advance(EngineFixture.LEASE.plusSeconds(1));
        ScanReport afterExpiry = scanner.scanOnce();

        assertEquals(1, afterExpiry.resumed());
        assertEquals(RunStatus.ADMITTED, fixture.statusOf("run-crashed"));
        assertEquals(1, fixture.invoker().invocationCount("code-quality"));
    }

    @Test
    void scanOnce_unstartedRun_shouldBeExecuted() {
        PipelineDefinition definition = lintPipeline();
        fixture.seedRun("run-queued", definition, RunContext.of("PR-202"));

        scanner.scanOnce();

        assertEquals(RunStatus.ADMITTED, fixture.statusOf("run-queued"));
    }

    @Test
    @DisplayName("A suspended run is left alone until its wait expires, then completes with a TIMEOUT")
    void scanOnce_suspendedRun_shouldResumeOnlyAfterWaitExpires() {
        signoffPipeline(Duration.ofMinutes(90));
        String runId = fixture.coordinator().createRun("signoff", RunContext.of("PR-203"));
        assertEquals(RunStatus.SUSPENDED, fixture.statusOf(runId));

        fixture.clock().advance(Duration.ofMinutes(60));
        assertEquals(0, scanner.scanOnce().resumed());
        assertEquals(RunStatus.SUSPENDED, fixture.statusOf(runId));

        fixture.clock().advance(Duration.ofMinutes(45));
        assertEquals(1, scanner.scanOnce().resumed());

        RunState run = fixture.run(runId);
        assertEquals(RunStatus.ADMITTED, run.status());
        assertEquals(TaskStatus.TIMEOUT, run.results().get("architect-signoff").status());
        assertEquals(1, fixture.invoker().invocationCount("architect-signoff"));
        assertEquals(1, fixture.invoker().invocationCount("jira-integration"));
    }

    // ========== SLA ==========

    @Test
    @DisplayName("A run still active past its deadline is reported once")
    void scanOnce_overdueRun_shouldReportBreachOnce() {
        signoffPipeline(Duration.ofHours(48));
        String runId = fixture.coordinator().createRun("signoff", RunContext.of("PR-204"));

        fixture.clock().advance(EngineFixture.RUN_SLA.minusMinutes(1));
        assertEquals(0, scanner.scanOnce().slaBreaches());

        fixture.clock().advance(Duration.ofMinutes(30));
        ScanReport first = scanner.scanOnce();
        ScanReport second = scanner.scanOnce();

        assertEquals(1, first.slaBreaches());
        assertEquals(0, second.slaBreaches());
        assertThat(fixture.events(RunEventType.SLA_BREACHED)).singleElement().satisfies(event -> {
            assertEquals(runId, event.runId());
            assertEquals("SUSPENDED", event.attribute("status"));
            assertEquals(String.valueOf(Duration.ofMinutes(29).toMillis()), event.attribute("overdueMs"));
        });
        assertEquals(RunStatus.SUSPENDED, fixture.statusOf(runId));
    }

    // ========== Compensation Replay ==========

    @Test
    @DisplayName("Compensation that failed is replayed after the grace period and not again once executed")
    void scanOnce_failedCompensation_shouldReplayAfterGrace() {
        lintPipeline();
        fixture.invoker().on("code-quality", Step.returning(TaskOutcome.failure(Severity.HIGH, null)));
        fixture.gateway().failNext(1);

        String runId = fixture.coordinator().createRun("review", RunContext.of("PR-205"));
        assertEquals(RunStatus.BLOCKED, fixture.statusOf(runId));
        assertEquals(CompensationStatus.FAILED, fixture.run(runId).compensationActions().get(0).status());

        assertEquals(0, scanner.scanOnce().compensated());
        assertEquals(1, fixture.gateway().countFor(runId));

        fixture.clock().advance(GRACE.plusSeconds(1));
        ScanReport report = scanner.scanOnce();

        assertEquals(1, report.compensated());
        assertEquals(2, fixture.gateway().countFor(runId));
        assertThat(fixture.run(runId).compensationActions()).singleElement()
            .satisfies(r -> assertEquals(CompensationStatus.EXECUTED, r.status()));
        assertThat(fixture.events(RunEventType.COMPENSATION_EXECUTED))
            .extracting(RunEvent::runId).containsExactly(runId);

        scanner.scanOnce();
        assertEquals(2, fixture.gateway().countFor(runId));
        assertEquals(RunStatus.BLOCKED, fixture.statusOf(runId));
    }

    // ========== Retention ==========

    @Test
    void scanOnce_terminalRunPastRetention_shouldBePurged() {
        lintPipeline();
        String oldRun = fixture.coordinator().createRun("review", RunContext.of("PR-207"));
        fixture.clock().advance(RETENTION.minusDays(1));
        String recentRun = fixture.coordinator().createRun("review", RunContext.of("PR-208"));

        fixture.clock().advance(Duration.ofDays(1).plusSeconds(1));
        ScanReport report = scanner.scanOnce();

        assertEquals(1, report.purged());
        assertFalse(fixture.store().get(oldRun).isPresent());
        assertEquals(RunStatus.ADMITTED, fixture.statusOf(recentRun));
    }

    // ========== Lifecycle ==========

    @Test
    void startAndStop_shouldToggleRunning() {
        scanner.start();
        assertTrue(scanner.isRunning());

        scanner.stop();
        assertFalse(scanner.isRunning());
    }
}

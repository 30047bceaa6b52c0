package com.reviewgate.recovery;

import com.reviewgate.core.exception.LeaseDeniedException;
import com.reviewgate.core.exception.ReviewGateException;
import com.reviewgate.core.model.CompensationRecord;
import com.reviewgate.core.model.PipelineDefinition;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.repository.PipelineDefinitionRepository;
import com.reviewgate.core.repository.RunStateRepository;
import com.reviewgate.engine.compensation.CompensationHandler;
import com.reviewgate.engine.events.RunEvent;
import com.reviewgate.engine.events.RunEventPublisher;
import com.reviewgate.engine.events.RunEventType;
import com.reviewgate.engine.execution.PipelineExecutionEngine;
import com.reviewgate.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic scan that keeps runs moving when nobody else will.
 *
 * Responsibilities:
 * - Resume unowned runs: crashed owners, received signals, expired waits
 * - Replay compensation that did not finish for BLOCKED and FAILED runs
 * - Report active runs past their deadline (once per run and process)
 * - Purge terminal runs past the retention window
 *
 * Every pass is safe to run concurrently in several processes: resumption
 * goes through the run lease and compensation records through conditional writes.
 */
public class ReconciliationScanner {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationScanner.class);

    private final RunStateRepository store;
    private final PipelineDefinitionRepository definitions;
    private final PipelineExecutionEngine engine;
    private final CompensationHandler compensationHandler;
    private final RunEventPublisher events;
    private final Executor runExecutor;
    private final ReconciliationSettings settings;
    private final Clock clock;

    private final Set<String> slaReported = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public ReconciliationScanner(
            RunStateRepository store,
            PipelineDefinitionRepository definitions,
            PipelineExecutionEngine engine,
            CompensationHandler compensationHandler,
            RunEventPublisher events,
            Executor runExecutor,
            ReconciliationSettings settings,
            Clock clock) {
        this.store = store;
        this.definitions = definitions;
        this.engine = engine;
        this.compensationHandler = compensationHandler;
        this.events = events;
        this.runExecutor = runExecutor;
        this.settings = settings;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "reviewgate-reconciliation");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start scanning at the configured interval.
     */
    public void start() {
        if (running) {
            log.warn("Reconciliation scanner already running");
            return;
        }
        running = true;
        long intervalMs = settings.interval().toMillis();
        scheduler.scheduleWithFixedDelay(this::scheduledPass, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Reconciliation scanner started (interval {}, retention {})",
            settings.interval(), settings.retention());
    }

    /**
     * Stop scanning. A pass in progress is allowed to finish.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Reconciliation scanner stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void scheduledPass() {
        if (!running) return;

        try {
            ScanReport report = scanOnce();
            if (!report.isEmpty()) {
                log.info("Reconciliation pass: {}", report);
            }
        } catch (Exception e) {
            log.error("Error in reconciliation pass", e);
        }
    }

    /**
     * Run one full pass.
     *
     * @return What the pass did
     */
    public ScanReport scanOnce() {
        Instant now = clock.instant();
        ResumePass resumption = resumeRuns(now);
        int compensated = replayCompensation(now);
        int purged = purgeExpired(now);
        return new ScanReport(resumption.resumed(), compensated, purged, resumption.breaches());
    }

    // ========== Resumption ==========

    private ResumePass resumeRuns(Instant now) {
        List<RunState> candidates;
        try {
            candidates = store.listResumable(settings.batchSize());
        } catch (RuntimeException e) {
            log.error("Could not list resumable runs", e);
            return new ResumePass(0, 0);
        }

        int resumed = 0;
        int breaches = 0;
        Set<String> overdue = new HashSet<>();
        for (RunState run : candidates) {
            try (var ctx = LoggingContext.forRun(run.runId(), run.context().subjectId())) {
                if (isOverdue(run, now)) {
                    overdue.add(run.runId());
                    if (slaReported.add(run.runId())) {
                        reportBreach(run, now);
                        breaches++;
                    }
                }
                if (engine.isExecuting(run.runId()) || !run.isResumable(now)) {
                    continue;
                }
                log.info("Resuming run {} (status {}, stage {})", run.runId(), run.status(), run.currentStage());
                runExecutor.execute(() -> resume(run.runId()));
                resumed++;
            } catch (Exception e) {
                log.error("Failed to reconcile run: {}", run.runId(), e);
            }
        }
        slaReported.retainAll(overdue);
        return new ResumePass(resumed, breaches);
    }

    private record ResumePass(int resumed, int breaches) {}

    private void resume(String runId) {
        try {
            RunState result = engine.execute(runId);
            log.debug("Resumed run {} is now {}", runId, result.status());
        } catch (LeaseDeniedException e) {
            log.debug("Run {} was claimed by another process", runId);
        } catch (ReviewGateException e) {
            log.warn("Could not resume run {}: [{}] {}", runId, e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error resuming run {}", runId, e);
        }
    }

    private static boolean isOverdue(RunState run, Instant now) {
        return run.deadline() != null && now.isAfter(run.deadline());
    }

    private void reportBreach(RunState run, Instant now) {
        Duration late = Duration.between(run.deadline(), now);
        log.warn("Run {} is still {} {} past its deadline", run.runId(), run.status(), late);
        events.publish(RunEvent.builder(RunEventType.SLA_BREACHED, run.runId(), now)
            .definition(run.definitionRef())
            .attr("status", run.status())
            .attr("deadline", run.deadline())
            .attr("overdueMs", late.toMillis())
            .build());
    }

    // ========== Compensation Replay ==========

    private int replayCompensation(Instant now) {
        List<RunState> candidates;
        try {
            candidates = store.listTerminalWithPendingCompensation(settings.batchSize());
        } catch (RuntimeException e) {
            log.error("Could not list runs with pending compensation", e);
            return 0;
        }

        int completed = 0;
        Instant settledBefore = now.minus(settings.compensationGrace());
        for (RunState run : candidates) {
            if (run.completedAt() != null && run.completedAt().isAfter(settledBefore)) {
                continue;
            }
            if (engine.isExecuting(run.runId())) {
                continue;
            }
            try (var ctx = LoggingContext.forRun(run.runId(), run.context().subjectId())) {
                Optional<PipelineDefinition> definition = definitions.find(run.definitionName(), run.definitionVersion());
                if (definition.isEmpty()) {
                    log.warn("Cannot replay compensation for run {}: pipeline {} is not registered",
                        run.runId(), run.definitionRef());
                    continue;
                }
                log.info("Replaying compensation for run {} ({})", run.runId(), run.status());
                RunState after = compensationHandler.compensate(run, definition.get());
                if (after.compensationActions().stream().allMatch(CompensationRecord::isDone)) {
                    completed++;
                }
            } catch (Exception e) {
                log.error("Failed to replay compensation for run: {}", run.runId(), e);
            }
        }
        return completed;
    }

    // ========== Retention ==========

    private int purgeExpired(Instant now) {
        if (settings.retention() == null) {
            return 0;
        }
        try {
            int deleted = store.deleteTerminalBefore(now.minus(settings.retention()));
            if (deleted > 0) {
                log.info("Purged {} terminal run(s) older than {}", deleted, settings.retention());
            }
            return deleted;
        } catch (RuntimeException e) {
            log.error("Error in retention purge", e);
            return 0;
        }
    }

    /**
     * Outcome of one pass.
     *
     * @param resumed Runs handed back to the engine
     * @param compensated Runs whose compensation completed during the pass
     * @param purged Terminal runs deleted
     * @param slaBreaches Runs newly reported past their deadline
     */
    public record ScanReport(int resumed, int compensated, int purged, int slaBreaches) {

        public boolean isEmpty() {
            return resumed == 0 && compensated == 0 && purged == 0 && slaBreaches == 0;
        }
    }
}

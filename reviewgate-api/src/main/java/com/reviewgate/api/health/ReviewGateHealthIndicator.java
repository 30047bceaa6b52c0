package com.reviewgate.api.health;

import com.reviewgate.api.config.ReviewGateProperties;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.repository.PipelineDefinitionRepository;
import com.reviewgate.core.repository.RunStateRepository;
import com.reviewgate.recovery.ReconciliationScanner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Health of the review gate.
 * Reports health status based on:
 * - Run state store reachability
 * - Registered pipelines
 * - Reconciliation backlog and scanner state
 */
@Component
public class ReviewGateHealthIndicator implements HealthIndicator {

    static final int BACKLOG_PROBE_LIMIT = 100;
    static final int BACKLOG_WARNING_THRESHOLD = 50;

    private final RunStateRepository store;
    private final PipelineDefinitionRepository definitions;
    private final ObjectProvider<ReconciliationScanner> scanner;
    private final ReviewGateProperties properties;
    private final Clock clock;

    public ReviewGateHealthIndicator(
            RunStateRepository store,
            PipelineDefinitionRepository definitions,
            ObjectProvider<ReconciliationScanner> scanner,
            ReviewGateProperties properties,
            Clock clock) {
        this.store = store;
        this.definitions = definitions;
        this.scanner = scanner;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("store", properties.getStore().getType());

        try {
            details.put("pipelines", definitions.findAll().size());

            List<RunState> resumable = store.listResumable(BACKLOG_PROBE_LIMIT);
            Instant now = clock.instant();
            long overdue = resumable.stream()
                .filter(run -> run.deadline() != null && now.isAfter(run.deadline()))
                .count();
            details.put("resumableRuns", resumable.size());
            details.put("overdueRuns", overdue);
            if (resumable.size() >= BACKLOG_WARNING_THRESHOLD) {
                details.put("backlogWarning", "High number of resumable runs - reconciliation may be slow");
            }

            ReconciliationScanner reconciliation = scanner.getIfAvailable();
            details.put("reconciliation", reconciliation == null ? "disabled"
                : reconciliation.isRunning() ? "running" : "stopped");
            if (reconciliation != null && !reconciliation.isRunning()) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}

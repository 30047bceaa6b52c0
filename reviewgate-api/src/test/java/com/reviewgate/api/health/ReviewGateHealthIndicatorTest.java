package com.reviewgate.api.health;

import com.reviewgate.api.config.ReviewGateProperties;
import com.reviewgate.core.model.PipelineDefinition;
import com.reviewgate.core.model.RunContext;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.repository.PipelineDefinitionRepository;
import com.reviewgate.core.repository.RunStateRepository;
import com.reviewgate.recovery.ReconciliationScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewGateHealthIndicatorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
    private static final PipelineDefinition PIPELINE =
        new PipelineDefinition("peer-review", 1, null, List.of(), null, null, null);

    @Mock
    private RunStateRepository store;

    @Mock
    private PipelineDefinitionRepository definitions;

    @Mock
    private ObjectProvider<ReconciliationScanner> scannerProvider;

    @Mock
    private ReconciliationScanner scanner;

    private ReviewGateHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new ReviewGateHealthIndicator(store, definitions, scannerProvider,
            new ReviewGateProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RunState run(String runId, Instant deadline) {
        return RunState.create(runId, PIPELINE, RunContext.of("PR-" + runId), NOW.minusSeconds(600), deadline);
    }

    @Test
    void health_scannerRunning_shouldBeUpWithBacklog() {
        when(definitions.findAll()).thenReturn(List.of(PIPELINE));
        when(store.listResumable(anyInt())).thenReturn(List.of(
            run("1", NOW.plusSeconds(60)), run("2", NOW.minusSeconds(60))));
        when(scannerProvider.getIfAvailable()).thenReturn(scanner);
        when(scanner.isRunning()).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("pipelines", 1)
            .containsEntry("resumableRuns", 2)
            .containsEntry("overdueRuns", 1L)
            .containsEntry("reconciliation", "running")
            .containsEntry("store", ReviewGateProperties.StoreType.MEMORY)
            .doesNotContainKey("backlogWarning");
    }

    @Test
    void health_scannerDisabled_shouldStayUp() {
        when(definitions.findAll()).thenReturn(List.of());
        when(store.listResumable(anyInt())).thenReturn(List.of());
        when(scannerProvider.getIfAvailable()).thenReturn(null);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("reconciliation", "disabled");
    }

    @Test
    void health_scannerStopped_shouldBeDown() {
        when(definitions.findAll()).thenReturn(List.of(PIPELINE));
        when(store.listResumable(anyInt())).thenReturn(List.of());
        when(scannerProvider.getIfAvailable()).thenReturn(scanner);
        when(scanner.isRunning()).thenReturn(false);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void health_storeUnreachable_shouldBeDown() {
        when(definitions.findAll()).thenReturn(List.of(PIPELINE));
        when(store.listResumable(anyInt())).thenThrow(new IllegalStateException("connection refused"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("pipelines", 1).containsKey("error");
    }
}

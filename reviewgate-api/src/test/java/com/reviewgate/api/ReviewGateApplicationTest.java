package com.reviewgate.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reviewgate.core.invocation.TaskOutcome;
import com.reviewgate.core.model.RunContext;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.model.RunStatus;
import com.reviewgate.core.model.Severity;
import com.reviewgate.core.model.TaskStatus;
import com.reviewgate.core.repository.PipelineDefinitionRepository;
import com.reviewgate.engine.service.RunTrigger;
import com.reviewgate.worker.LocalTaskInvoker;
import com.reviewgate.worker.TaskHandler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full application context on the in-memory store. The static analysis agents
 * are replaced by in-process handlers; conditional stages stay skipped.
 */
@SpringBootTest(properties = {
    "reviewgate.owner-id=test-node",
    "reviewgate.reconciliation.interval=1h"
})
@AutoConfigureMockMvc
class ReviewGateApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RunTrigger runTrigger;

    @Autowired
    private PipelineDefinitionRepository definitions;

    @Autowired
    private LocalTaskInvoker localTaskInvoker;

    @Autowired
    private ObjectMapper objectMapper;

    @TestConfiguration
    static class LocalAgents {

        @Bean(name = "agent/code-quality")
        TaskHandler codeQuality() {
            return ctx -> TaskOutcome.success(Severity.LOW, null);
        }

        @Bean(name = "agent/pattern-matching")
        TaskHandler patternMatching() {
            return ctx -> ctx.getPayload().path("attributes").path("legacyPatterns").asBoolean()
                ? TaskOutcome.success(Severity.HIGH, null)
                : TaskOutcome.success(Severity.NONE, null);
        }
    }

    private RunState awaitTerminal(String runId) throws InterruptedException {
        Instant deadline = Instant.now().plus(Duration.ofSeconds(10));
        RunState state = runTrigger.getRun(runId);
        while (!state.isTerminal() && Instant.now().isBefore(deadline)) {
            Thread.sleep(50);
            state = runTrigger.getRun(runId);
        }
        return state;
    }

    @Test
    void context_shouldRegisterBundledPipelineAndLocalHandlers() {
        assertThat(definitions.findLatest("peer-review")).isPresent();
        assertThat(localTaskInvoker.taskRefs())
            .containsExactlyInAnyOrder("agent/code-quality", "agent/pattern-matching");
    }

    @Test
    void createRun_cleanChange_shouldBeAdmitted() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/v1/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"pipeline":"peer-review","subjectId":"PR-100","attributes":{"linesChanged":12}}
                    """))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode body = objectMapper.readTree(created.getResponse().getContentAsString());

        RunState run = awaitTerminal(body.path("runId").asText());

        assertThat(run.status()).isEqualTo(RunStatus.ADMITTED);
        assertThat(run.results().get("code-quality").status()).isEqualTo(TaskStatus.SUCCESS);
        assertThat(run.results().get("pattern-matching").status()).isEqualTo(TaskStatus.SUCCESS);
        assertThat(run.results().get("architect").status()).isEqualTo(TaskStatus.SKIPPED);
        assertThat(run.results().get("lld-alignment").status()).isEqualTo(TaskStatus.SKIPPED);
        assertThat(run.results().get("jira-integration").status()).isEqualTo(TaskStatus.SKIPPED);
    }

    @Test
    void createRun_highSeverityFinding_shouldBeBlockedUnlessOverridden() throws Exception {
        JsonNode attributes = objectMapper.readTree("{\"linesChanged\":12,\"legacyPatterns\":true}");

        RunState blocked = awaitTerminal(runTrigger.createRun("peer-review",
            new RunContext("PR-200", attributes, null)));
        RunState overridden = awaitTerminal(runTrigger.createRun("peer-review",
            new RunContext("PR-201", attributes, Set.of("emergency-fix"))));

        assertThat(blocked.status()).isEqualTo(RunStatus.BLOCKED);
        assertThat(blocked.compensationActions()).hasSize(2);
        assertThat(overridden.status()).isEqualTo(RunStatus.ADMITTED);
        assertThat(overridden.decision().overrideLabel()).isEqualTo("emergency-fix");
    }

    @Test
    void pipelines_shouldListBundledDefinition() throws Exception {
        mockMvc.perform(get("/api/v1/pipelines/{ref}", "peer-review"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.stages.length()").value(4))
            .andExpect(jsonPath("$.compensationActions[0].actionType").value("NOTIFY_AUTHOR"));
    }

    @Test
    void health_shouldReportReviewGateDetails() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.components.reviewGate.details.reconciliation").value("running"));
    }
}

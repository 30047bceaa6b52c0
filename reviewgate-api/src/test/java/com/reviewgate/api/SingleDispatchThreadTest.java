package com.reviewgate.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reviewgate.core.model.RunContext;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.model.RunStatus;
import com.reviewgate.core.model.TaskStatus;
import com.reviewgate.engine.service.RunTrigger;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * One dispatch thread: agent calls must not queue behind the dispatch waiting on them.
 */
@SpringBootTest(properties = {
    "reviewgate.owner-id=single-thread-node",
    "reviewgate.dispatch-pool-size=1",
    "reviewgate.run-pool-size=1",
    "reviewgate.reconciliation.interval=1h"
})
@Import(ReviewGateApplicationTest.LocalAgents.class)
class SingleDispatchThreadTest {

    @Autowired
    private RunTrigger runTrigger;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void createRun_withOneDispatchThread_shouldInvokeAgentsWithoutTimingOut() throws Exception {
        String runId = runTrigger.createRun("peer-review",
            new RunContext("PR-300", objectMapper.readTree("{\"linesChanged\":5}"), null));

        Instant deadline = Instant.now().plus(Duration.ofSeconds(10));
        RunState run = runTrigger.getRun(runId);
        while (!run.isTerminal() && Instant.now().isBefore(deadline)) {
            Thread.sleep(50);
            run = runTrigger.getRun(runId);
        }

        assertThat(run.status()).isEqualTo(RunStatus.ADMITTED);
        assertThat(run.results().get("code-quality").status()).isEqualTo(TaskStatus.SUCCESS);
        assertThat(run.results().get("pattern-matching").status()).isEqualTo(TaskStatus.SUCCESS);
    }
}

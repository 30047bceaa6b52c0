package com.reviewgate.engine.decision;

import com.reviewgate.core.model.AggregatedResult;
import com.reviewgate.core.model.Decision;
import com.reviewgate.core.model.DecisionPolicy;
import com.reviewgate.core.model.ReasonCode;
import com.reviewgate.core.model.RunContext;
import com.reviewgate.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Applies a {@link DecisionPolicy} to an aggregated result.
 *
 * Order:
 * 1. an override label present in the context and allowed by the policy admits
 * 2. blocking issues or a severity count above its maximum block
 * 3. anything else admits, carrying warnings as factors
 */
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    public Decision decide(AggregatedResult aggregated, DecisionPolicy policy, RunContext context) {
        Optional<String> override = new TreeSet<>(context.labels()).stream()
            .filter(policy.overrideLabels()::contains)
            .findFirst();
        if (override.isPresent()) {
            log.info("Override label '{}' applied for subject {}", override.get(), context.subjectId());
            return Decision.override(override.get());
        }

        if (aggregated.blockingIssuesFound()) {
            List<String> factors = new ArrayList<>();
            List<String> failedBlocking = new ArrayList<>();
            for (String taskId : aggregated.blockingTasks()) {
                if (aggregated.failedRequiredTasks().contains(taskId) && policy.blocksOnFailure(taskId)) {
                    failedBlocking.add(taskId);
                    factors.add("required-failed:" + taskId);
                } else {
                    factors.add("severity:" + taskId);
                }
            }
            factors.add("overall-severity:" + aggregated.overallSeverity());
            if (!failedBlocking.isEmpty()) {
                return Decision.block(ReasonCode.REQUIRED_TASK_FAILED,
                    "required task(s) failed: " + String.join(", ", failedBlocking), factors);
            }
            return Decision.block(ReasonCode.SEVERITY_THRESHOLD,
                String.format("severity at or above %s reported by: %s",
                    policy.blockingSeverity(), String.join(", ", aggregated.blockingTasks())),
                factors);
        }

        for (Severity severity : Severity.values()) {
            Optional<Integer> max = policy.maxCountFor(severity);
            int count = aggregated.countOf(severity);
            if (max.isPresent() && count > max.get()) {
                return Decision.block(ReasonCode.SEVERITY_COUNT_EXCEEDED,
                    String.format("%d %s result(s) exceed the maximum of %d", count, severity, max.get()),
                    List.of("count:" + severity + "=" + count));
            }
        }

        return Decision.admit(ReasonCode.NO_BLOCKING_ISSUES, "no blocking issues", aggregated.warnings());
    }
}

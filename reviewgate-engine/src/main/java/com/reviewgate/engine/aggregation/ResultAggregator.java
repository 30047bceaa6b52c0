package com.reviewgate.engine.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reviewgate.core.model.AggregatedResult;
import com.reviewgate.core.model.AggregationMode;
import com.reviewgate.core.model.DecisionPolicy;
import com.reviewgate.core.model.PipelineDefinition;
import com.reviewgate.core.model.Severity;
import com.reviewgate.core.model.TaskResult;
import com.reviewgate.core.model.TaskStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces task results into an {@link AggregatedResult}.
 *
 * Pure: the output depends only on the results, the definition and the
 * policy, so it is recomputed whenever needed instead of stored. Adding a
 * result never lowers the overall severity.
 */
public class ResultAggregator {

    private static final String EXTENSIONS = "extensions";

    public AggregatedResult aggregate(Collection<TaskResult> results, PipelineDefinition definition,
                                      DecisionPolicy policy) {
        Map<Severity, Integer> severityCounts = new EnumMap<>(Severity.class);
        Map<TaskStatus, Integer> statusCounts = new EnumMap<>(TaskStatus.class);
        List<String> failedRequired = new ArrayList<>();
        List<String> blocking = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        ObjectNode extensions = JsonNodeFactory.instance.objectNode();

        Severity maxSeverity = Severity.NONE;
        int weightedScore = 0;

        for (TaskResult result : results) {
            statusCounts.merge(result.status(), 1, Integer::sum);
            if (!result.counted()) {
                continue;
            }
            severityCounts.merge(result.severity(), 1, Integer::sum);
            maxSeverity = Severity.max(maxSeverity, result.severity());
            weightedScore += policy.weightOf(result.severity());

            boolean required = definition.isRequired(result.taskId());
            if (result.status().isFailure()) {
                if (required) {
                    failedRequired.add(result.taskId());
                    if (policy.blocksOnFailure(result.taskId())) {
                        blocking.add(result.taskId());
                    } else {
                        warnings.add(String.format("required task %s %s (blocking disabled)",
                            result.taskId(), result.status()));
                    }
                } else {
                    warnings.add(String.format("task %s %s", result.taskId(), result.status()));
                }
            }
            if (policy.blockingSeverity() != null
                    && result.severity().atLeast(policy.blockingSeverity())
                    && !blocking.contains(result.taskId())) {
                blocking.add(result.taskId());
            }

            JsonNode payload = result.payload();
            if (payload != null && payload.isObject() && payload.has(EXTENSIONS)) {
                extensions.set(result.taskId(), payload.get(EXTENSIONS));
            }
        }

        Severity overall = policy.aggregationMode() == AggregationMode.WEIGHTED
            ? weightedSeverity(weightedScore, policy)
            : maxSeverity;

        return new AggregatedResult(
            overall,
            severityCounts,
            statusCounts,
            weightedScore,
            !blocking.isEmpty(),
            failedRequired,
            blocking,
            warnings,
            extensions
        );
    }

    /**
     * Highest severity whose weight does not exceed the score. Every counted
     * result contributes its own weight, so this is never below the MAX severity.
     */
    private static Severity weightedSeverity(int score, DecisionPolicy policy) {
        Severity overall = Severity.NONE;
        for (Severity severity : Severity.values()) {
            if (policy.weightOf(severity) <= score) {
                overall = severity;
            }
        }
        return overall;
    }
}

package com.reviewgate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/**
 * Reduction of a run's task results. Derived, never persisted on its own;
 * always recomputable from the result set.
 */
public record AggregatedResult(
    Severity overallSeverity,
    Map<Severity, Integer> severityCounts,
    Map<TaskStatus, Integer> statusCounts,
    int weightedScore,
    boolean blockingIssuesFound,
    List<String> failedRequiredTasks,
    List<String> blockingTasks,
    List<String> warnings,
    JsonNode extensions
) {
    public AggregatedResult {
        severityCounts = Map.copyOf(severityCounts);
        statusCounts = Map.copyOf(statusCounts);
        failedRequiredTasks = List.copyOf(failedRequiredTasks);
        blockingTasks = List.copyOf(blockingTasks);
        warnings = List.copyOf(warnings);
    }

    public int countOf(Severity severity) {
        return severityCounts.getOrDefault(severity, 0);
    }

    public int countOf(TaskStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }
}

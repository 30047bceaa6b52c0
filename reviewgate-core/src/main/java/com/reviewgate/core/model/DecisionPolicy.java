package com.reviewgate.core.model;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Policy turning an aggregated result into admit or block.
 *
 * - blockingSeverity: any result at or above it blocks (null disables the check)
 * - maxCounts: maximum number of results allowed per severity
 * - taskBlockFlags: per required task, whether its failure blocks (default true)
 * - overrideLabels: context labels that force admission
 * - aggregationMode and weights: how the overall severity is computed
 */
public record DecisionPolicy(
    Severity blockingSeverity,
    Map<Severity, Integer> maxCounts,
    Map<String, Boolean> taskBlockFlags,
    Set<String> overrideLabels,
    AggregationMode aggregationMode,
    Map<Severity, Integer> weights
) {
    public DecisionPolicy {
        maxCounts = maxCounts != null ? Map.copyOf(maxCounts) : Map.of();
        taskBlockFlags = taskBlockFlags != null ? Map.copyOf(taskBlockFlags) : Map.of();
        overrideLabels = overrideLabels != null ? Set.copyOf(overrideLabels) : Set.of();
        aggregationMode = aggregationMode != null ? aggregationMode : AggregationMode.MAX;
        weights = weights != null ? Map.copyOf(weights) : Map.of();
    }

    /**
     * Default policy: block on HIGH or worse, MAX aggregation, no overrides.
     */
    public static DecisionPolicy defaultPolicy() {
        return new DecisionPolicy(Severity.HIGH, null, null, null, AggregationMode.MAX, null);
    }

    public int weightOf(Severity severity) {
        Integer configured = weights.get(severity);
        return configured != null ? configured : severity.defaultWeight();
    }

    /**
     * Whether a failure of the given required task blocks the run.
     */
    public boolean blocksOnFailure(String taskId) {
        return taskBlockFlags.getOrDefault(taskId, Boolean.TRUE);
    }

    public Optional<Integer> maxCountFor(Severity severity) {
        return Optional.ofNullable(maxCounts.get(severity));
    }

    /**
     * Resolved weight table, one entry per severity.
     */
    public Map<Severity, Integer> effectiveWeights() {
        Map<Severity, Integer> resolved = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            resolved.put(severity, weightOf(severity));
        }
        return resolved;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Severity blockingSeverity = Severity.HIGH;
        private final Map<Severity, Integer> maxCounts = new EnumMap<>(Severity.class);
        private final Map<String, Boolean> taskBlockFlags = new HashMap<>();
        private Set<String> overrideLabels = Set.of();
        private AggregationMode aggregationMode = AggregationMode.MAX;
        private final Map<Severity, Integer> weights = new EnumMap<>(Severity.class);

        public Builder blockingSeverity(Severity blockingSeverity) {
            this.blockingSeverity = blockingSeverity;
            return this;
        }

        public Builder maxCount(Severity severity, int max) {
            this.maxCounts.put(severity, max);
            return this;
        }

        public Builder taskBlockFlag(String taskId, boolean blocks) {
            this.taskBlockFlags.put(taskId, blocks);
            return this;
        }

        public Builder overrideLabels(String... labels) {
            this.overrideLabels = Set.of(labels);
            return this;
        }

        public Builder aggregationMode(AggregationMode aggregationMode) {
            this.aggregationMode = aggregationMode;
            return this;
        }

        public Builder weight(Severity severity, int weight) {
            this.weights.put(severity, weight);
            return this;
        }

        public DecisionPolicy build() {
            return new DecisionPolicy(blockingSeverity, maxCounts, taskBlockFlags,
                overrideLabels, aggregationMode, weights);
        }
    }
}

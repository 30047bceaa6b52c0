package com.reviewgate.core.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable, versioned blueprint of a review pipeline.
 * Loaded once per run and never mutated.
 *
 * Identity: (name, version), rendered as {@code name:version}.
 *
 * Invariants (enforced by validation, not here):
 * - stage ids and task ids are unique
 * - dependsOn graph is acyclic and never points forward across stages
 * - every custom predicate is registered
 */
public record PipelineDefinition(
    String name,
    int version,
    String description,
    List<Stage> stages,
    PipelineDefaults defaults,
    DecisionPolicy policy,
    List<CompensationActionSpec> compensationActions
) {
    public PipelineDefinition {
        stages = stages != null ? List.copyOf(stages) : List.of();
        defaults = defaults != null ? defaults.orElse(PipelineDefaults.standard()) : PipelineDefaults.standard();
        compensationActions = compensationActions != null ? List.copyOf(compensationActions) : List.of();
    }

    public String id() {
        return ref(name, version);
    }

    public static String ref(String name, int version) {
        return name + ":" + version;
    }

    /**
     * Policy declared by the definition, or the given fallback.
     */
    public DecisionPolicy policyOrElse(DecisionPolicy fallback) {
        return policy != null ? policy : fallback;
    }

    /**
     * All tasks across all stages, in declared order.
     */
    public List<TaskSpec> allTasks() {
        return stages.stream()
            .flatMap(s -> s.tasks().stream())
            .collect(Collectors.toList());
    }

    public Optional<TaskSpec> findTask(String taskId) {
        return allTasks().stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    /**
     * Stage containing the given task.
     */
    public Optional<Stage> stageOf(String taskId) {
        return stages.stream()
            .filter(s -> s.tasks().stream().anyMatch(t -> t.id().equals(taskId)))
            .findFirst();
    }

    /**
     * Whether the task is required, either by itself or through its stage.
     */
    public boolean isRequired(String taskId) {
        return stageOf(taskId)
            .flatMap(s -> s.tasks().stream()
                .filter(t -> t.id().equals(taskId))
                .findFirst()
                .map(s::isTaskRequired))
            .orElse(false);
    }

    public static Builder builder(String name, int version) {
        return new Builder(name, version);
    }

    public static class Builder {
        private final String name;
        private final int version;
        private String description;
        private final List<Stage> stages = new java.util.ArrayList<>();
        private PipelineDefaults defaults;
        private DecisionPolicy policy;
        private final List<CompensationActionSpec> compensationActions = new java.util.ArrayList<>();

        private Builder(String name, int version) {
            this.name = name;
            this.version = version;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder stage(Stage stage) {
            this.stages.add(stage);
            return this;
        }

        public Builder defaults(PipelineDefaults defaults) {
            this.defaults = defaults;
            return this;
        }

        public Builder policy(DecisionPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder compensation(CompensationActionSpec action) {
            this.compensationActions.add(action);
            return this;
        }

        public PipelineDefinition build() {
            return new PipelineDefinition(name, version, description, stages, defaults,
                policy, compensationActions);
        }
    }
}

package com.reviewgate.engine.execution;

import com.reviewgate.core.exception.DefinitionValidationException;
import com.reviewgate.core.model.CompensationActionSpec;
import com.reviewgate.core.model.Condition;
import com.reviewgate.core.model.ConditionType;
import com.reviewgate.core.model.DecisionPolicy;
import com.reviewgate.core.model.PipelineDefaults;
import com.reviewgate.core.model.PipelineDefinition;
import com.reviewgate.core.model.Severity;
import com.reviewgate.core.model.Stage;
import com.reviewgate.core.model.TaskSpec;
import com.reviewgate.engine.condition.PredicateRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rejects malformed pipeline definitions before any task executes.
 *
 * Checks:
 * - name and version present, at least one stage
 * - unique stage ids and task ids, non-blank task references
 * - dependsOn targets exist, never point to a later stage, and are acyclic
 * - RESULT conditions name a known task, CUSTOM conditions a registered predicate
 * - FIELD/RESULT conditions carry an operator, and a value where it needs one
 * - timeouts and parallelism are positive
 * - policy weights and count limits are non-negative
 */
public class DefinitionValidator {

    private final PredicateRegistry predicates;
    private final WavePlanner wavePlanner;

    public DefinitionValidator(PredicateRegistry predicates) {
        this.predicates = predicates;
        this.wavePlanner = new WavePlanner();
    }

    /**
     * Validate a definition.
     *
     * @param definition The definition
     * @throws DefinitionValidationException listing every violation found
     */
    public void validate(PipelineDefinition definition) {
        List<String> violations = new ArrayList<>();

        if (definition.name() == null || definition.name().isBlank()) {
            violations.add("name: must not be blank");
        }
        if (definition.version() < 1) {
            violations.add("version: must be >= 1");
        }
        if (definition.stages().isEmpty()) {
            violations.add("stages: at least one stage is required");
        }
        validateDefaults(definition.defaults(), violations);

        // task id -> index of its stage
        Map<String, Integer> taskStage = new HashMap<>();
        Set<String> stageIds = new HashSet<>();
        for (int i = 0; i < definition.stages().size(); i++) {
            Stage stage = definition.stages().get(i);
            String where = "stages[" + i + "]";
            if (stage.id() == null || stage.id().isBlank()) {
                violations.add(where + ".id: must not be blank");
            } else if (!stageIds.add(stage.id())) {
                violations.add(where + ".id: duplicate stage id '" + stage.id() + "'");
            }
            if (stage.parallelism() != null && stage.parallelism() < 1) {
                violations.add(where + ".parallelism: must be positive");
            }
            if (stage.tasks().isEmpty()) {
                violations.add(where + ".tasks: at least one task is required");
            }
            for (TaskSpec task : stage.tasks()) {
                if (task.id() == null || task.id().isBlank()) {
                    violations.add(where + ".tasks: task id must not be blank");
                } else if (taskStage.putIfAbsent(task.id(), i) != null) {
                    violations.add("tasks." + task.id() + ": duplicate task id");
                }
            }
        }

        for (int i = 0; i < definition.stages().size(); i++) {
            Stage stage = definition.stages().get(i);
            validateCondition(stage.condition(), "stages." + stage.id() + ".condition", taskStage, violations);
            boolean localDependencies = false;
            for (TaskSpec task : stage.tasks()) {
                String where = "tasks." + task.id();
                if (task.taskRef() == null || task.taskRef().isBlank()) {
                    violations.add(where + ".taskRef: must not be blank");
                }
                if (!isPositive(task.timeout())) {
                    violations.add(where + ".timeout: must be positive");
                }
                if (!isPositive(task.waitTimeout())) {
                    violations.add(where + ".waitTimeout: must be positive");
                }
                if (task.retries() != null && task.retries() < 0) {
                    violations.add(where + ".retries: must not be negative");
                }
                validateCondition(task.condition(), where + ".condition", taskStage, violations);
                for (String dep : task.dependsOn()) {
                    Integer depStage = taskStage.get(dep);
                    if (depStage == null) {
                        violations.add(where + ".dependsOn: unknown task '" + dep + "'");
                    } else if (depStage > i) {
                        violations.add(where + ".dependsOn: '" + dep + "' belongs to a later stage");
                    } else if (depStage == i) {
                        localDependencies = true;
                    }
                }
            }
            if (localDependencies) {
                try {
                    wavePlanner.plan(stage);
                } catch (DefinitionValidationException e) {
                    violations.addAll(e.getViolations());
                }
            }
        }

        validatePolicy(definition.policy(), violations);
        validateCompensation(definition.compensationActions(), violations);

        if (!violations.isEmpty()) {
            throw new DefinitionValidationException(violations);
        }
    }

    private void validateDefaults(PipelineDefaults defaults, List<String> violations) {
        if (!isPositive(defaults.taskTimeout())) {
            violations.add("defaults.taskTimeout: must be positive");
        }
        if (!isPositive(defaults.waitTimeout())) {
            violations.add("defaults.waitTimeout: must be positive");
        }
        if (defaults.parallelism() != null && defaults.parallelism() < 1) {
            violations.add("defaults.parallelism: must be positive");
        }
    }

    private void validateCondition(Condition condition, String where,
                                   Map<String, Integer> taskStage, List<String> violations) {
        if (condition == null) {
            return;
        }
        ConditionType type = condition.type();
        switch (type) {
            case CUSTOM -> {
                if (condition.name() == null || !predicates.contains(condition.name())) {
                    violations.add(where + ": unregistered custom predicate '" + condition.name() + "'");
                }
            }
            case RESULT -> {
                if (condition.taskId() == null || !taskStage.containsKey(condition.taskId())) {
                    violations.add(where + ": unknown task '" + condition.taskId() + "'");
                }
                validateOperator(condition, where, violations);
            }
            case FIELD -> {
                if (condition.path() == null || condition.path().isBlank()) {
                    violations.add(where + ": path must not be blank");
                }
                validateOperator(condition, where, violations);
            }
            default -> {
                // ALWAYS and NEVER carry nothing to check
            }
        }
    }

    private void validateOperator(Condition condition, String where, List<String> violations) {
        if (condition.operator() == null) {
            violations.add(where + ": operator is required");
        } else if (condition.operator().requiresValue()
                && (condition.value() == null || condition.value().isNull())) {
            violations.add(where + ": operator " + condition.operator() + " requires a value");
        }
    }

    private void validatePolicy(DecisionPolicy policy, List<String> violations) {
        if (policy == null) {
            return;
        }
        for (Map.Entry<Severity, Integer> weight : policy.weights().entrySet()) {
            if (weight.getValue() < 0) {
                violations.add("policy.weights." + weight.getKey() + ": must not be negative");
            }
        }
        for (Map.Entry<Severity, Integer> max : policy.maxCounts().entrySet()) {
            if (max.getValue() < 0) {
                violations.add("policy.maxCounts." + max.getKey() + ": must not be negative");
            }
        }
    }

    private void validateCompensation(List<CompensationActionSpec> actions, List<String> violations) {
        Set<String> ids = new HashSet<>();
        for (CompensationActionSpec action : actions) {
            if (action.id() == null || action.id().isBlank()) {
                violations.add("compensationActions: id must not be blank");
            } else if (!ids.add(action.id())) {
                violations.add("compensationActions." + action.id() + ": duplicate action id");
            }
            if (action.actionType() == null || action.actionType().isBlank()) {
                violations.add("compensationActions." + action.id() + ".actionType: must not be blank");
            }
        }
    }

    private static boolean isPositive(Duration duration) {
        return duration == null || (!duration.isNegative() && !duration.isZero());
    }
}

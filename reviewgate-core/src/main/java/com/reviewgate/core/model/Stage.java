package com.reviewgate.core.model;

import java.util.List;

/**
 * An ordered group of tasks sharing one condition and one dispatch mode.
 * A required stage makes every task it contains required.
 */
public record Stage(
    String id,
    ExecutionMode mode,
    Condition condition,
    boolean required,
    Boolean failFast,
    Integer parallelism,
    List<TaskSpec> tasks
) {
    public Stage {
        mode = mode != null ? mode : ExecutionMode.SEQUENTIAL;
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }

    public static Stage sequential(String id, TaskSpec... tasks) {
        return new Stage(id, ExecutionMode.SEQUENTIAL, null, false, null, null, List.of(tasks));
    }

    public static Stage parallel(String id, TaskSpec... tasks) {
        return new Stage(id, ExecutionMode.PARALLEL, null, false, null, null, List.of(tasks));
    }

    public Stage withCondition(Condition newCondition) {
        return new Stage(id, mode, newCondition, required, failFast, parallelism, tasks);
    }

    public Stage withRequired(boolean newRequired) {
        return new Stage(id, mode, condition, newRequired, failFast, parallelism, tasks);
    }

    public Stage withFailFast(Boolean newFailFast) {
        return new Stage(id, mode, condition, required, newFailFast, parallelism, tasks);
    }

    public Stage withParallelism(Integer newParallelism) {
        return new Stage(id, mode, condition, required, failFast, newParallelism, tasks);
    }

    public boolean effectiveFailFast(PipelineDefaults defaults) {
        return failFast != null ? failFast : defaults.failFast();
    }

    /**
     * Parallelism cap; sequential stages always run one task at a time.
     */
    public int effectiveParallelism(PipelineDefaults defaults) {
        if (mode == ExecutionMode.SEQUENTIAL) {
            return 1;
        }
        return parallelism != null ? parallelism : defaults.parallelism();
    }

    /**
     * A task is required if it or its stage says so.
     */
    public boolean isTaskRequired(TaskSpec task) {
        return required || task.required();
    }
}

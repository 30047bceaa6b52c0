package com.reviewgate.engine.condition;

import com.reviewgate.core.model.RunContext;
import com.reviewgate.core.model.TaskResult;

import java.util.Map;

/**
 * Named predicate referenced from a CUSTOM condition.
 * Must be pure: same inputs, same answer, no side effects.
 */
@FunctionalInterface
public interface CustomPredicate {

    boolean test(RunContext context, Map<String, TaskResult> results);
}

package com.reviewgate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Declarative guard on a stage or task. Serializable as JSON; custom
 * predicates are referenced by name only.
 *
 * Shapes by type:
 * - ALWAYS, NEVER: no fields
 * - FIELD: path, operator, value
 * - RESULT: taskId, field, operator, value
 * - CUSTOM: name
 */
public record Condition(
    ConditionType type,
    String path,
    Operator operator,
    JsonNode value,
    String taskId,
    String field,
    String name
) {
    private static final Condition ALWAYS = new Condition(ConditionType.ALWAYS, null, null, null, null, null, null);
    private static final Condition NEVER = new Condition(ConditionType.NEVER, null, null, null, null, null, null);

    public Condition {
        if (type == null) {
            type = ConditionType.ALWAYS;
        }
    }

    public static Condition always() {
        return ALWAYS;
    }

    public static Condition never() {
        return NEVER;
    }

    public static Condition field(String path, Operator operator, JsonNode value) {
        return new Condition(ConditionType.FIELD, path, operator, value, null, null, null);
    }

    public static Condition field(String path, Operator operator, String value) {
        return field(path, operator, JsonNodeFactory.instance.textNode(value));
    }

    public static Condition fieldExists(String path) {
        return field(path, Operator.EXISTS, (JsonNode) null);
    }

    public static Condition result(String taskId, String field, Operator operator, JsonNode value) {
        return new Condition(ConditionType.RESULT, null, operator, value, taskId, field, null);
    }

    public static Condition result(String taskId, String field, Operator operator, String value) {
        return result(taskId, field, operator, JsonNodeFactory.instance.textNode(value));
    }

    public static Condition custom(String name) {
        return new Condition(ConditionType.CUSTOM, null, null, null, null, null, name);
    }
}

package com.reviewgate.engine.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.reviewgate.core.model.Condition;
import com.reviewgate.core.model.Operator;
import com.reviewgate.core.model.RunContext;
import com.reviewgate.core.model.Severity;
import com.reviewgate.core.model.TaskResult;
import com.reviewgate.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates stage and task conditions against the run context and prior results.
 *
 * Total and side-effect free: every input yields true or false. Type
 * mismatches, invalid regexes and absent results evaluate false and are
 * logged, never thrown.
 */
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private static final String SUBJECT_ID = "subjectId";
    private static final String LABELS = "labels";
    private static final String ATTRIBUTES = "attributes";
    private static final String STATUS = "status";
    private static final String SEVERITY = "severity";

    private final PredicateRegistry predicates;
    private final Map<String, Optional<Pattern>> patternCache = new ConcurrentHashMap<>();

    public ConditionEvaluator(PredicateRegistry predicates) {
        this.predicates = predicates;
    }

    /**
     * Evaluate a condition. A null condition always holds.
     *
     * @param condition The condition, may be null
     * @param context The run context
     * @param results Results recorded so far, keyed by task id
     * @return whether the guarded stage or task should run
     */
    public boolean evaluate(Condition condition, RunContext context, Map<String, TaskResult> results) {
        if (condition == null) {
            return true;
        }
        return switch (condition.type()) {
            case ALWAYS -> true;
            case NEVER -> false;
            case FIELD -> compare(condition.operator(), resolveField(condition.path(), context),
                condition.value(), false, condition.path());
            case RESULT -> evaluateResult(condition, results);
            case CUSTOM -> evaluateCustom(condition.name(), context, results);
        };
    }

    // ========== Field Resolution ==========

    JsonNode resolveField(String path, RunContext context) {
        if (path == null || path.isBlank()) {
            return null;
        }
        String[] segments = path.split("\\.");
        switch (segments[0]) {
            case SUBJECT_ID -> {
                JsonNode subject = context.subjectId() != null
                    ? JsonNodeFactory.instance.textNode(context.subjectId()) : null;
                return walk(subject, segments, 1);
            }
            case LABELS -> {
                ArrayNode labels = JsonNodeFactory.instance.arrayNode();
                new TreeSet<>(context.labels()).forEach(labels::add);
                return walk(labels, segments, 1);
            }
            case ATTRIBUTES -> {
                return walk(context.attributes(), segments, 1);
            }
            default -> {
                // bare paths address attributes
                return walk(context.attributes(), segments, 0);
            }
        }
    }

    private static JsonNode walk(JsonNode root, String[] segments, int start) {
        JsonNode current = root;
        for (int i = start; i < segments.length && current != null; i++) {
            String segment = segments[i];
            if (current.isArray()) {
                current = isIndex(segment) ? current.get(Integer.parseInt(segment)) : null;
            } else if (current.isObject()) {
                current = current.get(segment);
            } else {
                current = null;
            }
        }
        return current == null || current.isNull() || current.isMissingNode() ? null : current;
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    // ========== Result Conditions ==========

    private boolean evaluateResult(Condition condition, Map<String, TaskResult> results) {
        TaskResult result = results.get(condition.taskId());
        if (result == null || result.status() == TaskStatus.SKIPPED) {
            log.debug("Result condition on {} is false: no result recorded", condition.taskId());
            return false;
        }
        String field = condition.field() != null ? condition.field() : STATUS;
        return switch (field) {
            case STATUS -> compare(condition.operator(),
                JsonNodeFactory.instance.textNode(result.status().name()),
                condition.value(), false, condition.taskId() + "." + field);
            case SEVERITY -> compare(condition.operator(),
                JsonNodeFactory.instance.textNode(result.severity().name()),
                condition.value(), true, condition.taskId() + "." + field);
            default -> compare(condition.operator(),
                result.payload() != null ? walk(result.payload(), field.split("\\."), 0) : null,
                condition.value(), false, condition.taskId() + "." + field);
        };
    }

    private boolean evaluateCustom(String name, RunContext context, Map<String, TaskResult> results) {
        Optional<CustomPredicate> predicate = name != null ? predicates.find(name) : Optional.empty();
        if (predicate.isEmpty()) {
            log.warn("Custom predicate '{}' is not registered; evaluating false", name);
            return false;
        }
        try {
            return predicate.get().test(context, results);
        } catch (RuntimeException e) {
            log.warn("Custom predicate '{}' threw; evaluating false", name, e);
            return false;
        }
    }

    // ========== Operators ==========

    private boolean compare(Operator operator, JsonNode actual, JsonNode expected, boolean severity, String where) {
        if (operator == null) {
            log.warn("Condition on {} has no operator; evaluating false", where);
            return false;
        }
        if (operator == Operator.EXISTS) {
            return actual != null;
        }
        if (operator == Operator.NOT_EXISTS) {
            return actual == null;
        }
        if (actual == null) {
            return false;
        }
        if (expected == null || expected.isNull()) {
            log.warn("Condition {} on {} has no value; evaluating false", operator, where);
            return false;
        }
        return switch (operator) {
            case EQ -> equalsOrMismatch(actual, expected, severity, where).orElse(false);
            case NE -> equalsOrMismatch(actual, expected, severity, where).map(eq -> !eq).orElse(false);
            case GT -> ordering(actual, expected, severity, where).map(c -> c > 0).orElse(false);
            case LT -> ordering(actual, expected, severity, where).map(c -> c < 0).orElse(false);
            case CONTAINS -> contains(actual, expected, where);
            case MATCHES -> matches(actual, expected, where);
            default -> false;
        };
    }

    private Optional<Boolean> equalsOrMismatch(JsonNode actual, JsonNode expected, boolean severity, String where) {
        if (severity) {
            return ordering(actual, expected, true, where).map(c -> c == 0);
        }
        if (actual.isNumber() && expected.isNumber()) {
            return Optional.of(actual.decimalValue().compareTo(expected.decimalValue()) == 0);
        }
        if (actual.isTextual() && expected.isTextual()) {
            return Optional.of(actual.asText().equals(expected.asText()));
        }
        if (actual.isBoolean() && expected.isBoolean()) {
            return Optional.of(actual.booleanValue() == expected.booleanValue());
        }
        if (actual.getNodeType() == expected.getNodeType()) {
            return Optional.of(actual.equals(expected));
        }
        return mismatch(actual, expected, where);
    }

    private Optional<Integer> ordering(JsonNode actual, JsonNode expected, boolean severity, String where) {
        if (severity) {
            Optional<Severity> left = Severity.parse(actual.asText());
            Optional<Severity> right = expected.isTextual() ? Severity.parse(expected.asText()) : Optional.empty();
            if (left.isEmpty() || right.isEmpty()) {
                log.warn("Severity comparison on {} with non-severity value '{}'; evaluating false", where, expected);
                return Optional.empty();
            }
            return Optional.of(Integer.compare(left.get().ordinal(), right.get().ordinal()));
        }
        if (actual.isNumber() && expected.isNumber()) {
            return Optional.of(actual.decimalValue().compareTo(expected.decimalValue()));
        }
        return mismatch(actual, expected, where);
    }

    private boolean contains(JsonNode actual, JsonNode expected, String where) {
        if (actual.isArray()) {
            for (JsonNode element : actual) {
                if (equalsOrMismatch(element, expected, false, where).orElse(false)) {
                    return true;
                }
            }
            return false;
        }
        if (actual.isTextual() && expected.isTextual()) {
            return actual.asText().contains(expected.asText());
        }
        if (actual.isObject() && expected.isTextual()) {
            return actual.has(expected.asText());
        }
        return this.<Boolean>mismatch(actual, expected, where).orElse(false);
    }

    private boolean matches(JsonNode actual, JsonNode expected, String where) {
        if (!actual.isValueNode() || !expected.isTextual()) {
            return this.<Boolean>mismatch(actual, expected, where).orElse(false);
        }
        Optional<Pattern> pattern = patternCache.computeIfAbsent(expected.asText(), regex -> {
            try {
                return Optional.of(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                log.warn("Invalid regex '{}' in condition on {}: {}", regex, where, e.getDescription());
                return Optional.empty();
            }
        });
        return pattern.map(p -> p.matcher(actual.asText()).find()).orElse(false);
    }

    private <T> Optional<T> mismatch(JsonNode actual, JsonNode expected, String where) {
        log.warn("Type mismatch in condition on {}: {} vs {}; evaluating false",
            where, actual.getNodeType(), expected.getNodeType());
        return Optional.empty();
    }
}

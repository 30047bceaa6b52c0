package com.reviewgate.engine.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.reviewgate.core.model.RunContext;
import com.reviewgate.core.model.TaskResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed set of custom predicates available to pipeline definitions.
 * Populated at startup; definitions referencing an unknown name are rejected.
 */
public class PredicateRegistry {

    public static final String HAS_DESIGN_DOC = "hasDesignDoc";
    public static final String HAS_TICKET = "hasTicket";
    public static final String TOUCHES_MANY_FILES = "touchesManyFiles";

    private static final int MANY_FILES_THRESHOLD = 20;

    private final Map<String, CustomPredicate> predicates = new LinkedHashMap<>();

    public PredicateRegistry register(String name, CustomPredicate predicate) {
        if (predicates.putIfAbsent(name, predicate) != null) {
            throw new IllegalStateException("Predicate already registered: " + name);
        }
        return this;
    }

    public Optional<CustomPredicate> find(String name) {
        return Optional.ofNullable(predicates.get(name));
    }

    public boolean contains(String name) {
        return predicates.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(predicates.keySet());
    }

    /**
     * Registry with the predicates used by the bundled review pipelines.
     */
    public static PredicateRegistry withDefaults() {
        return new PredicateRegistry()
            .register(HAS_DESIGN_DOC, (ctx, results) -> hasText(ctx, "designDocUrl"))
            .register(HAS_TICKET, (ctx, results) -> hasText(ctx, "ticketId"))
            .register(TOUCHES_MANY_FILES, PredicateRegistry::touchesManyFiles);
    }

    private static boolean hasText(RunContext context, String attribute) {
        JsonNode node = context.attributes().get(attribute);
        return node != null && node.isTextual() && !node.asText().isBlank();
    }

    private static boolean touchesManyFiles(RunContext context, Map<String, TaskResult> results) {
        JsonNode files = context.attributes().get("files");
        return files != null && files.isArray() && files.size() >= MANY_FILES_THRESHOLD;
    }
}

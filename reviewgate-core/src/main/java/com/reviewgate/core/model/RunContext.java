package com.reviewgate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Set;

/**
 * Immutable input of a run: the change under review and its labels.
 */
public record RunContext(
    String subjectId,
    JsonNode attributes,
    Set<String> labels
) {
    public RunContext {
        attributes = attributes != null ? attributes : JsonNodeFactory.instance.objectNode();
        labels = labels != null ? Set.copyOf(labels) : Set.of();
    }

    public static RunContext of(String subjectId) {
        return new RunContext(subjectId, null, null);
    }

    public RunContext withLabels(Set<String> newLabels) {
        return new RunContext(subjectId, attributes, newLabels);
    }
}

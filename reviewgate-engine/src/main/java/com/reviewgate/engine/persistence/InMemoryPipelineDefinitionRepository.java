package com.reviewgate.engine.persistence;

import com.reviewgate.core.exception.DefinitionValidationException;
import com.reviewgate.core.model.PipelineDefinition;
import com.reviewgate.core.repository.PipelineDefinitionRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of PipelineDefinitionRepository.
 * Definitions are loaded at startup from bundled JSON documents.
 */
public class InMemoryPipelineDefinitionRepository implements PipelineDefinitionRepository {

    private final Map<String, PipelineDefinition> definitions = new ConcurrentHashMap<>();

    @Override
    public synchronized void save(PipelineDefinition definition) {
        PipelineDefinition existing = definitions.get(definition.id());
        if (existing != null && !existing.equals(definition)) {
            throw new DefinitionValidationException("version",
                "pipeline " + definition.id() + " is already registered with different content");
        }
        definitions.put(definition.id(), definition);
    }

    @Override
    public Optional<PipelineDefinition> find(String name, int version) {
        return Optional.ofNullable(definitions.get(PipelineDefinition.ref(name, version)));
    }

    @Override
    public Optional<PipelineDefinition> findLatest(String name) {
        return definitions.values().stream()
            .filter(d -> d.name().equals(name))
            .max(Comparator.comparingInt(PipelineDefinition::version));
    }

    @Override
    public List<PipelineDefinition> findAll() {
        return definitions.values().stream()
            .sorted(Comparator.comparing(PipelineDefinition::name)
                .thenComparingInt(PipelineDefinition::version))
            .collect(Collectors.toList());
    }
}

package com.reviewgate.core.repository;

import com.reviewgate.core.model.PipelineDefinition;
import java.util.List;
import java.util.Optional;

/**
 * Repository for registered pipeline definitions.
 * Definitions are immutable once saved; a change requires a new version.
 */
public interface PipelineDefinitionRepository {

    /**
     * Register a definition.
     *
     * @param definition The definition to save
     * @throws com.reviewgate.core.exception.DefinitionValidationException if the same
     *         name and version is registered with different content
     */
    void save(PipelineDefinition definition);

    /**
     * Find a specific version.
     *
     * @param name The pipeline name
     * @param version The pipeline version
     * @return The definition if found
     */
    Optional<PipelineDefinition> find(String name, int version);

    /**
     * Find the highest registered version of a pipeline.
     *
     * @param name The pipeline name
     * @return The latest definition if any version exists
     */
    Optional<PipelineDefinition> findLatest(String name);

    /**
     * Resolve a reference of the form {@code name} or {@code name:version}.
     *
     * @param ref The definition reference
     * @return The definition if found
     */
    default Optional<PipelineDefinition> resolve(String ref) {
        int idx = ref.lastIndexOf(':');
        if (idx > 0) {
            try {
                int version = Integer.parseInt(ref.substring(idx + 1));
                return find(ref.substring(0, idx), version);
            } catch (NumberFormatException e) {
                return findLatest(ref);
            }
        }
        return findLatest(ref);
    }

    /**
     * List all registered definitions.
     *
     * @return All definitions
     */
    List<PipelineDefinition> findAll();
}

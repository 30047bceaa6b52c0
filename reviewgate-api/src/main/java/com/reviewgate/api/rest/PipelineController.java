package com.reviewgate.api.rest;

import com.reviewgate.core.exception.NotFoundException;
import com.reviewgate.core.model.PipelineDefinition;
import com.reviewgate.core.model.Stage;
import com.reviewgate.core.repository.PipelineDefinitionRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;

/**
 * Read-only view of the registered pipeline definitions.
 */
@RestController
@RequestMapping("/api/v1/pipelines")
public class PipelineController {

    private final PipelineDefinitionRepository definitions;

    public PipelineController(PipelineDefinitionRepository definitions) {
        this.definitions = definitions;
    }

    @GetMapping
    public ResponseEntity<List<PipelineSummary>> listPipelines() {
        List<PipelineSummary> summaries = definitions.findAll().stream()
            .sorted(Comparator.comparing(PipelineDefinition::name).thenComparingInt(PipelineDefinition::version))
            .map(PipelineSummary::from)
            .toList();
        return ResponseEntity.ok(summaries);
    }

    /**
     * Get a definition by {@code name} (latest version) or {@code name:version}.
     */
    @GetMapping("/{ref}")
    public ResponseEntity<PipelineDefinition> getPipeline(@PathVariable String ref) {
        PipelineDefinition definition = definitions.resolve(ref)
            .orElseThrow(() -> new NotFoundException("PipelineDefinition", ref));
        return ResponseEntity.ok(definition);
    }

    // ========== DTOs ==========

    public record PipelineSummary(
        String name,
        int version,
        String description,
        List<String> stages,
        int taskCount
    ) {
        static PipelineSummary from(PipelineDefinition definition) {
            return new PipelineSummary(
                definition.name(),
                definition.version(),
                definition.description(),
                definition.stages().stream().map(Stage::id).toList(),
                definition.allTasks().size()
            );
        }
    }
}

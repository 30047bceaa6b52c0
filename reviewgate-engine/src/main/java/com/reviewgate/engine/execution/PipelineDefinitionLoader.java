package com.reviewgate.engine.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reviewgate.core.exception.DefinitionValidationException;
import com.reviewgate.core.model.PipelineDefaults;
import com.reviewgate.core.model.PipelineDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads pipeline definitions from JSON and validates them.
 * Defaults missing from the document are filled from the configured
 * pipeline defaults.
 */
public class PipelineDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(PipelineDefinitionLoader.class);

    private final ObjectMapper objectMapper;
    private final DefinitionValidator validator;
    private final PipelineDefaults configuredDefaults;

    public PipelineDefinitionLoader(ObjectMapper objectMapper, DefinitionValidator validator,
                                    PipelineDefaults configuredDefaults) {
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.configuredDefaults = configuredDefaults != null ? configuredDefaults : PipelineDefaults.standard();
    }

    public PipelineDefinition load(String json) {
        try {
            return fromTree(objectMapper.readTree(json), "inline");
        } catch (IOException e) {
            throw new DefinitionValidationException("Unreadable pipeline definition: " + e.getMessage(), e);
        }
    }

    /**
     * Load a definition from a stream. The stream is not closed.
     *
     * @param in JSON document
     * @param source Name used in log and error messages
     * @return The validated definition
     * @throws DefinitionValidationException if the document is unreadable or invalid
     */
    public PipelineDefinition load(InputStream in, String source) {
        try {
            return fromTree(objectMapper.readTree(in), source);
        } catch (IOException e) {
            throw new DefinitionValidationException(
                "Unreadable pipeline definition " + source + ": " + e.getMessage(), e);
        }
    }

    private PipelineDefinition fromTree(JsonNode tree, String source) throws IOException {
        if (tree == null || !tree.isObject()) {
            throw new DefinitionValidationException("document", "expected a JSON object in " + source);
        }
        PipelineDefinition parsed = objectMapper.treeToValue(tree, PipelineDefinition.class);

        // The record fills unset defaults with built-ins; re-merge from the raw node against configuration
        JsonNode defaultsNode = tree.get("defaults");
        PipelineDefaults declared = defaultsNode != null && defaultsNode.isObject()
            ? objectMapper.treeToValue(defaultsNode, PipelineDefaults.class)
            : new PipelineDefaults(null, null, null, null, null);
        PipelineDefinition definition = new PipelineDefinition(
            parsed.name(),
            parsed.version(),
            parsed.description(),
            parsed.stages(),
            declared.orElse(configuredDefaults),
            parsed.policy(),
            parsed.compensationActions()
        );

        validator.validate(definition);
        log.info("Loaded pipeline definition {} from {} ({} stages, {} tasks)",
            definition.id(), source, definition.stages().size(), definition.allTasks().size());
        return definition;
    }
}

package com.reviewgate.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reviewgate.core.invocation.TaskOutcome;
import com.reviewgate.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a review agent's response body into a {@link TaskOutcome}.
 *
 * Agents answer with a JSON object, often wrapped in Markdown code fences.
 * Only {@code status} and severities are interpreted:
 * <ul>
 *   <li>{@code status} of FAILURE, FAIL or ERROR gives a FAILURE outcome, anything else SUCCESS</li>
 *   <li>a top-level {@code severity} wins; otherwise the highest severity of the
 *       entries in {@code violations}, {@code deviations} or {@code findings}</li>
 * </ul>
 * A body that is not a JSON object gives a FAILURE outcome whose payload keeps
 * the first {@value #RAW_LIMIT} characters under {@code _raw}.
 */
public class AgentResponseParser {

    private static final Logger log = LoggerFactory.getLogger(AgentResponseParser.class);

    static final int RAW_LIMIT = 1000;

    private static final Pattern OPENING_FENCE = Pattern.compile("```(?:json)?\\s*");
    private static final Pattern CLOSING_FENCE = Pattern.compile("```\\s*$");
    private static final Set<String> FAILURE_STATUSES = Set.of("FAILURE", "FAIL", "ERROR");
    private static final List<String> FINDING_ARRAYS = List.of("violations", "deviations", "findings");

    private final ObjectMapper objectMapper;

    public AgentResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TaskOutcome parse(String body) {
        String cleaned = stripFences(body);
        JsonNode document;
        try {
            document = cleaned.isEmpty() ? null : objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.warn("Agent response is not JSON: {}", e.getOriginalMessage());
            document = null;
        }
        if (document == null || !document.isObject()) {
            return unreadable(body);
        }

        Severity severity = declaredSeverity(document);
        String status = document.path("status").asText("").trim().toUpperCase(Locale.ROOT);
        return FAILURE_STATUSES.contains(status)
            ? TaskOutcome.failure(severity, document)
            : TaskOutcome.success(severity, document);
    }

    static String stripFences(String body) {
        if (body == null) {
            return "";
        }
        String cleaned = OPENING_FENCE.matcher(body).replaceAll("");
        return CLOSING_FENCE.matcher(cleaned).replaceAll("").trim();
    }

    private static Severity declaredSeverity(JsonNode document) {
        Severity declared = Severity.parse(document.path("severity").asText(null)).orElse(null);
        if (declared != null) {
            return declared;
        }
        Severity highest = Severity.NONE;
        for (String field : FINDING_ARRAYS) {
            for (JsonNode entry : document.path(field)) {
                Severity entrySeverity = Severity.parse(entry.path("severity").asText(null)).orElse(null);
                highest = Severity.max(highest, entrySeverity);
            }
        }
        return highest;
    }

    private TaskOutcome unreadable(String body) {
        String raw = body != null ? body : "";
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("status", "ERROR");
        payload.put("summary", "Failed to parse response. Raw output available.");
        payload.put("_raw", raw.length() > RAW_LIMIT ? raw.substring(0, RAW_LIMIT) : raw);
        return TaskOutcome.failure(Severity.NONE, payload);
    }
}

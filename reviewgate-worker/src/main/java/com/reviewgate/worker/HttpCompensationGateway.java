package com.reviewgate.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reviewgate.core.compensation.CompensationGateway;
import com.reviewgate.core.compensation.CompensationRequest;
import com.reviewgate.core.exception.CompensationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Issues compensation actions (ticket creation, notifications) over HTTP.
 * Each action type maps to an endpoint; the request carries an
 * {@code Idempotency-Key} of {@code runId:actionId} so replays are deduplicated remotely.
 */
public class HttpCompensationGateway implements CompensationGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpCompensationGateway.class);

    public static final String NO_ENDPOINT = "NO_ENDPOINT";
    public static final String TRANSPORT = "TRANSPORT_ERROR";
    public static final String REJECTED = "REJECTED";

    private final Map<String, URI> endpoints;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpCompensationGateway(Map<String, URI> endpoints, HttpClient httpClient,
                                   ObjectMapper objectMapper, Duration requestTimeout) {
        this.endpoints = Map.copyOf(endpoints);
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void execute(CompensationRequest request) throws CompensationException {
        URI endpoint = endpoints.get(request.actionType());
        if (endpoint == null) {
            throw new CompensationException(NO_ENDPOINT,
                "No endpoint configured for compensation type " + request.actionType());
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .header(HttpTaskInvoker.IDEMPOTENCY_HEADER, request.idempotencyKey())
            .POST(HttpRequest.BodyPublishers.ofString(requestBody(request)))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CompensationException(TRANSPORT, "Call to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompensationException(TRANSPORT, "Interrupted while calling " + endpoint, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new CompensationException(status >= 500 ? TRANSPORT : REJECTED,
                "HTTP " + status + " from " + endpoint);
        }
        log.info("Compensation {} ({}) accepted for run {}", request.actionId(), request.actionType(), request.runId());
    }

    private String requestBody(CompensationRequest request) throws CompensationException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("runId", request.runId());
        body.put("subjectId", request.subjectId());
        body.put("actionId", request.actionId());
        body.put("actionType", request.actionType());
        body.put("runStatus", request.runStatus() != null ? request.runStatus().name() : null);
        body.put("reason", request.reason());
        body.set("params", request.params());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new CompensationException(REJECTED, "Cannot serialize compensation request", e);
        }
    }
}

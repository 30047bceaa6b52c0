package com.reviewgate.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reviewgate.core.exception.TaskInvocationException;
import com.reviewgate.core.invocation.TaskInvocation;
import com.reviewgate.core.invocation.TaskInvoker;
import com.reviewgate.core.invocation.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * Invokes review agents over HTTP.
 *
 * Each task reference maps to an endpoint. The invocation is POSTed as JSON
 * with an {@code Idempotency-Key} header carrying {@code runId:taskId:attempt}.
 *
 * Response handling:
 * - 202 Accepted: the task suspends; its result arrives later as a resume signal
 * - other 2xx: the body is parsed leniently by {@link AgentResponseParser}
 * - 408, 429 and 5xx: retryable transport error
 * - any other status: permanent rejection
 */
public class HttpTaskInvoker implements TaskInvoker {

    private static final Logger log = LoggerFactory.getLogger(HttpTaskInvoker.class);

    public static final String IDEMPOTENCY_HEADER = "Idempotency-Key";
    public static final String NO_ENDPOINT = "NO_ENDPOINT";

    private final Map<String, URI> endpoints;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AgentResponseParser parser;

    public HttpTaskInvoker(Map<String, URI> endpoints, ObjectMapper objectMapper) {
        this(endpoints, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), objectMapper);
    }

    public HttpTaskInvoker(Map<String, URI> endpoints, HttpClient httpClient, ObjectMapper objectMapper) {
        this.endpoints = Map.copyOf(endpoints);
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.parser = new AgentResponseParser(objectMapper);
    }

    public boolean handles(String taskRef) {
        return endpoints.containsKey(taskRef);
    }

    @Override
    public TaskOutcome invoke(TaskInvocation invocation) throws TaskInvocationException {
        URI endpoint = endpoints.get(invocation.taskRef());
        if (endpoint == null) {
            throw TaskInvocationException.permanent(NO_ENDPOINT,
                "No endpoint configured for task reference " + invocation.taskRef());
        }

        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(endpoint)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header(IDEMPOTENCY_HEADER, invocation.idempotencyKey())
            .POST(HttpRequest.BodyPublishers.ofString(requestBody(invocation)));
        if (invocation.timeout() != null) {
            request.timeout(invocation.timeout());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TaskInvocationException(TaskInvocationException.TIMEOUT,
                "No response from " + endpoint + " within " + invocation.timeout(), e, true);
        } catch (IOException e) {
            throw TaskInvocationException.transientFailure(TaskInvocationException.TRANSPORT,
                "Call to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskInvocationException(TaskInvocationException.TRANSPORT,
                "Interrupted while calling " + endpoint, e, false);
        }

        int status = response.statusCode();
        log.debug("Task {} ({}) answered HTTP {}", invocation.taskId(), invocation.taskRef(), status);
        if (status == 202) {
            return TaskOutcome.suspendedOutcome();
        }
        if (status >= 200 && status < 300) {
            return parser.parse(response.body());
        }
        if (status == 408 || status == 429 || status >= 500) {
            throw TaskInvocationException.transientFailure(TaskInvocationException.TRANSPORT,
                "HTTP " + status + " from " + endpoint, null);
        }
        throw TaskInvocationException.permanent(TaskInvocationException.REJECTED,
            "HTTP " + status + " from " + endpoint + ": " + abbreviate(response.body()));
    }

    private String requestBody(TaskInvocation invocation) throws TaskInvocationException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("runId", invocation.runId());
        body.put("taskId", invocation.taskId());
        body.put("taskRef", invocation.taskRef());
        body.put("attempt", invocation.attempt());
        body.put("idempotencyKey", invocation.idempotencyKey());
        body.set("payload", invocation.payload());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TaskInvocationException(TaskInvocationException.REJECTED,
                "Cannot serialize invocation payload", e, false);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}

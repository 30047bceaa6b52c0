package com.reviewgate.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reviewgate.core.compensation.CompensationRequest;
import com.reviewgate.core.exception.CompensationException;
import com.reviewgate.core.model.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HttpCompensationGatewayTest {

    private static final URI TICKETS = URI.create("http://tickets.internal/api/issues");

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private HttpCompensationGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new HttpCompensationGateway(Map.of("OPEN_TICKET", TICKETS), httpClient,
            new ObjectMapper(), Duration.ofSeconds(10));
    }

    private static CompensationRequest request(String actionType) {
        return new CompensationRequest("run-9", "PR-9", "open-ticket", actionType, null,
            RunStatus.BLOCKED, "required task architect FAILURE", "run-9:open-ticket");
    }

    private void respond(int status) throws Exception {
        when(response.statusCode()).thenReturn(status);
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
            .thenReturn(response);
    }

    @Test
    void execute_accepted_shouldSendIdempotencyKey() throws Exception {
        respond(201);

        gateway.execute(request("OPEN_TICKET"));

        ArgumentCaptor<HttpRequest> sent = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(sent.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
        assertEquals(TICKETS, sent.getValue().uri());
        assertThat(sent.getValue().headers().firstValue(HttpTaskInvoker.IDEMPOTENCY_HEADER)).hasValue("run-9:open-ticket");
    }

    @Test
    void execute_serverError_shouldRaiseTransportError() throws Exception {
        respond(502);

        CompensationException error = catchThrowableOfType(
            () -> gateway.execute(request("OPEN_TICKET")), CompensationException.class);

        assertEquals(HttpCompensationGateway.TRANSPORT, error.getErrorCode());
    }

    @Test
    void execute_unknownActionType_shouldFail() {
        CompensationException error = catchThrowableOfType(
            () -> gateway.execute(request("PAGE_ONCALL")), CompensationException.class);

        assertEquals(HttpCompensationGateway.NO_ENDPOINT, error.getErrorCode());
    }
}

package com.reviewgate.engine.events;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RunEventPublisherTest {

    private static final Instant AT = Instant.parse("2026-03-02T09:00:00Z");

    @Test
    void publish_failingListener_shouldNotStopOthers() {
        List<RunEvent> received = new ArrayList<>();
        RunEventPublisher publisher = new RunEventPublisher(List.<RunEventListener>of(
            event -> {
                throw new IllegalStateException("metrics backend down");
            },
            received::add));
        publisher.register(new LoggingRunEventListener());

        publisher.publish(RunEvent.builder(RunEventType.RUN_CREATED, "run-1", AT).build());

        assertEquals(1, received.size());
    }

    @Test
    void builder_nullAttributes_shouldBeOmitted() {
        RunEvent event = RunEvent.builder(RunEventType.TASK_STARTED, "run-1", AT)
            .task("security")
            .attr("attempt", 2)
            .attr("errorCode", null)
            .build();

        assertEquals("2", event.attribute("attempt"));
        assertNull(event.attribute("errorCode"));
        assertEquals(1, event.attributes().size());
    }
}

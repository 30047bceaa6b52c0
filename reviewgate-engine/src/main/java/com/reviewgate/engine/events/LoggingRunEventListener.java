package com.reviewgate.engine.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Writes every run event as one key=value line.
 */
public class LoggingRunEventListener implements RunEventListener {

    private static final Logger log = LoggerFactory.getLogger("com.reviewgate.events");

    @Override
    public void onEvent(RunEvent event) {
        if (!log.isInfoEnabled()) {
            return;
        }
        StringBuilder line = new StringBuilder()
            .append("event=").append(event.type())
            .append(" runId=").append(event.runId());
        if (event.definitionRef() != null) {
            line.append(" pipeline=").append(event.definitionRef());
        }
        if (event.stageId() != null) {
            line.append(" stage=").append(event.stageId());
        }
        if (event.taskId() != null) {
            line.append(" task=").append(event.taskId());
        }
        for (Map.Entry<String, String> attr : event.attributes().entrySet()) {
            line.append(' ').append(attr.getKey()).append('=').append(attr.getValue());
        }
        log.info(line.toString());
    }
}

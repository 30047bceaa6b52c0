package com.reviewgate.worker;

import com.reviewgate.core.compensation.CompensationGateway;
import com.reviewgate.core.compensation.CompensationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway used when no compensation endpoint is configured: records the action in the log.
 */
public class LoggingCompensationGateway implements CompensationGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingCompensationGateway.class);

    @Override
    public void execute(CompensationRequest request) {
        log.warn("Compensation {} ({}) for run {} of {}: {} ({})",
            request.actionId(), request.actionType(), request.runId(), request.subjectId(),
            request.runStatus(), request.reason());
    }
}

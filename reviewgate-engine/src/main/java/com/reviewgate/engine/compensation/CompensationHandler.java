package com.reviewgate.engine.compensation;

import com.reviewgate.core.compensation.CompensationGateway;
import com.reviewgate.core.compensation.CompensationRequest;
import com.reviewgate.core.exception.CompensationException;
import com.reviewgate.core.exception.NotFoundException;
import com.reviewgate.core.exception.StateConflictException;
import com.reviewgate.core.model.CompensationActionSpec;
import com.reviewgate.core.model.CompensationRecord;
import com.reviewgate.core.model.PipelineDefinition;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.repository.RunStateRepository;
import com.reviewgate.engine.events.RunEvent;
import com.reviewgate.engine.events.RunEventPublisher;
import com.reviewgate.engine.events.RunEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Issues a pipeline's declared compensation actions for BLOCKED and FAILED runs.
 *
 * Each outcome is recorded on the run through a conditional write, so a
 * replayed pass skips EXECUTED actions and re-issues PENDING or FAILED ones.
 * Gateway failures are recorded, never thrown.
 */
public class CompensationHandler {

    private static final Logger log = LoggerFactory.getLogger(CompensationHandler.class);

    private static final int MAX_WRITE_ATTEMPTS = 5;

    private final CompensationGateway gateway;
    private final RunStateRepository store;
    private final RunEventPublisher events;
    private final Clock clock;

    public CompensationHandler(CompensationGateway gateway, RunStateRepository store,
                               RunEventPublisher events, Clock clock) {
        this.gateway = gateway;
        this.store = store;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Run (or replay) compensation for a terminal run.
     *
     * @param state The terminal run
     * @param definition Its pipeline definition
     * @return The run with updated compensation records
     */
    public RunState compensate(RunState state, PipelineDefinition definition) {
        if (!state.status().requiresCompensation()) {
            return state;
        }
        RunState current = state;
        for (CompensationActionSpec action : definition.compensationActions()) {
            CompensationRecord record = findRecord(current, action.id())
                .orElse(CompensationRecord.pending(action));
            if (record.isDone()) {
                log.debug("Compensation {} already executed for run {}", action.id(), state.runId());
                continue;
            }

            CompensationRequest request = new CompensationRequest(
                current.runId(),
                current.context().subjectId(),
                action.id(),
                action.actionType(),
                action.params(),
                current.status(),
                current.reason(),
                current.runId() + ":" + action.id()
            );

            CompensationRecord outcome;
            try {
                gateway.execute(request);
                outcome = record.executed(clock.instant());
                log.info("Compensation {} ({}) executed for run {}", action.id(), action.actionType(), state.runId());
            } catch (CompensationException e) {
                outcome = record.failed(e.getErrorCode() + ": " + e.getMessage());
                log.warn("Compensation {} failed for run {}: {}", action.id(), state.runId(), e.getMessage());
            } catch (RuntimeException e) {
                outcome = record.failed(e.toString());
                log.error("Compensation gateway error on {} for run {}", action.id(), state.runId(), e);
            }

            current = record(current, outcome);
            events.publish(RunEvent.builder(
                    outcome.isDone() ? RunEventType.COMPENSATION_EXECUTED : RunEventType.COMPENSATION_FAILED,
                    current.runId(), clock.instant())
                .definition(definition.id())
                .attr("actionId", action.id())
                .attr("actionType", action.actionType())
                .attr("attempts", outcome.attempts())
                .build());
        }
        return current;
    }

    private RunState record(RunState state, CompensationRecord outcome) {
        RunState base = state;
        for (int i = 0; i < MAX_WRITE_ATTEMPTS; i++) {
            RunState next = base.withCompensation(outcome).toBuilder()
                .updatedAt(clock.instant())
                .build();
            try {
                return store.conditionalPut(next, base.version());
            } catch (StateConflictException e) {
                base = store.get(state.runId())
                    .orElseThrow(() -> new NotFoundException("Run", state.runId()));
            }
        }
        throw new StateConflictException(state.runId(), MAX_WRITE_ATTEMPTS);
    }

    private static Optional<CompensationRecord> findRecord(RunState state, String actionId) {
        return state.compensationActions().stream()
            .filter(r -> r.actionId().equals(actionId))
            .findFirst();
    }
}

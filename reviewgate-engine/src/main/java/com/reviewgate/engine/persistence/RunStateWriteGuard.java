package com.reviewgate.engine.persistence;

import com.reviewgate.core.exception.InvalidStateTransitionException;
import com.reviewgate.core.model.RunState;

import java.util.Objects;

/**
 * Write rules shared by the state stores: status changes follow the run state
 * machine, and a terminal record only accepts compensation and bookkeeping updates.
 */
public final class RunStateWriteGuard {

    private RunStateWriteGuard() {
    }

    public static void check(RunState current, RunState next) {
        if (current.status() != next.status() && !current.status().canTransitionTo(next.status())) {
            throw new InvalidStateTransitionException(current.status(), next.status());
        }
        if (current.isTerminal()
                && (!current.results().equals(next.results())
                    || !Objects.equals(current.decision(), next.decision()))) {
            throw new InvalidStateTransitionException(current.runId(), current.status(), "change its outcome");
        }
        if (next.currentStage() < current.currentStage()) {
            throw new IllegalArgumentException(String.format(
                "Run %s cannot move back from stage %d to %d",
                current.runId(), current.currentStage(), next.currentStage()));
        }
    }
}

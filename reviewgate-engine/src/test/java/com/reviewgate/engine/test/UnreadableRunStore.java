package com.reviewgate.engine.test;

import com.reviewgate.core.exception.StateCorruptionException;
import com.reviewgate.core.model.RunState;
import com.reviewgate.engine.persistence.InMemoryRunStateRepository;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store whose records can be made unreadable, the way a row with
 * an unknown schema version reads from the database.
 */
public class UnreadableRunStore extends InMemoryRunStateRepository {

    private final Set<String> unreadable = ConcurrentHashMap.newKeySet();

    public UnreadableRunStore(Clock clock) {
        super(clock);
    }

    public void corrupt(String runId) {
        unreadable.add(runId);
    }

    /**
     * The record as held, bypassing the corruption check.
     */
    public RunState stored(String runId) {
        return super.get(runId).orElseThrow();
    }

    @Override
    public Optional<RunState> get(String runId) {
        check(runId);
        return super.get(runId);
    }

    @Override
    public RunState conditionalPut(RunState state, long expectedVersion) {
        check(state.runId());
        return super.conditionalPut(state, expectedVersion);
    }

    @Override
    public RunState leaseClaim(String runId, String ownerId, Duration duration) {
        check(runId);
        return super.leaseClaim(runId, ownerId, duration);
    }

    private void check(String runId) {
        if (unreadable.contains(runId)) {
            throw new StateCorruptionException(runId, "unsupported schema version 7");
        }
    }
}

package com.reviewgate.engine.persistence;

import com.reviewgate.core.exception.InvalidStateTransitionException;
import com.reviewgate.core.exception.LeaseDeniedException;
import com.reviewgate.core.exception.NotFoundException;
import com.reviewgate.core.exception.StateConflictException;
import com.reviewgate.core.model.RunLease;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.model.RunStatus;
import com.reviewgate.core.repository.RunStateRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of RunStateRepository.
 * Single-process only; used for local runs and tests.
 */
public class InMemoryRunStateRepository implements RunStateRepository {

    private final Map<String, RunState> runs = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRunStateRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<RunState> get(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public synchronized RunState create(RunState state) {
        RunState existing = runs.get(state.runId());
        if (existing != null) {
            throw StateConflictException.duplicate(state.runId());
        }
        RunState stored = state.toBuilder().version(1L).build();
        runs.put(stored.runId(), stored);
        return stored;
    }

    @Override
    public synchronized RunState conditionalPut(RunState state, long expectedVersion) {
        RunState current = require(state.runId());
        if (current.version() != expectedVersion) {
            throw new StateConflictException(state.runId(), expectedVersion, current.version());
        }
        RunStateWriteGuard.check(current, state);
        RunState stored = state.toBuilder().version(expectedVersion + 1).build();
        runs.put(stored.runId(), stored);
        return stored;
    }

    @Override
    public synchronized RunState leaseClaim(String runId, String ownerId, Duration duration) {
        RunState current = require(runId);
        if (current.isTerminal()) {
            throw new InvalidStateTransitionException(runId, current.status(), "be claimed");
        }
        Instant now = clock.instant();
        RunLease lease = current.lease();
        if (lease != null && !lease.canBeClaimedBy(ownerId, now)) {
            throw new LeaseDeniedException(runId, lease.ownerId());
        }
        RunLease claimed = lease != null && lease.isHeldBy(ownerId)
            ? lease.renew(now, duration)
            : RunLease.acquire(ownerId, now, duration);
        RunState stored = current.toBuilder()
            .lease(claimed)
            .version(current.version() + 1)
            .build();
        runs.put(runId, stored);
        return stored;
    }

    @Override
    public synchronized boolean leaseRelease(String runId, String ownerId) {
        RunState current = runs.get(runId);
        if (current == null || current.lease() == null || !current.lease().isHeldBy(ownerId)) {
            return false;
        }
        runs.put(runId, current.toBuilder()
            .lease(null)
            .version(current.version() + 1)
            .build());
        return true;
    }

    /**
     * Records held here are never unreadable; this exists for callers that
     * detected corruption elsewhere.
     */
    @Override
    public synchronized boolean markCorrupt(String runId, String reason) {
        RunState current = runs.get(runId);
        if (current == null || current.isTerminal()) {
            return false;
        }
        Instant now = clock.instant();
        runs.put(runId, current.toBuilder()
            .status(RunStatus.FAILED)
            .reason(reason)
            .lease(null)
            .updatedAt(now)
            .completedAt(now)
            .version(current.version() + 1)
            .build());
        return true;
    }

    @Override
    public List<RunState> listResumable(int limit) {
        Instant now = clock.instant();
        return runs.values().stream()
            .filter(r -> !r.isTerminal())
            .filter(r -> !r.isLeased(now))
            .sorted(Comparator.comparing(RunState::updatedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<RunState> findActiveBySubject(String definitionName, String subjectId) {
        return runs.values().stream()
            .filter(r -> !r.isTerminal())
            .filter(r -> r.definitionName().equals(definitionName))
            .filter(r -> Objects.equals(r.context().subjectId(), subjectId))
            .sorted(Comparator.comparing(RunState::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<RunState> listTerminalWithPendingCompensation(int limit) {
        return runs.values().stream()
            .filter(r -> r.status().requiresCompensation())
            .filter(r -> r.compensationActions().stream().anyMatch(c -> !c.isDone()))
            .sorted(Comparator.comparing(RunState::updatedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized int deleteTerminalBefore(Instant completedBefore) {
        List<String> toDelete = runs.values().stream()
            .filter(RunState::isTerminal)
            .filter(r -> r.completedAt() != null && r.completedAt().isBefore(completedBefore))
            .map(RunState::runId)
            .collect(Collectors.toList());

        toDelete.forEach(runs::remove);
        return toDelete.size();
    }

    private RunState require(String runId) {
        RunState current = runs.get(runId);
        if (current == null) {
            throw new NotFoundException("Run", runId);
        }
        return current;
    }
}

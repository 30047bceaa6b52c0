package com.reviewgate.core.repository;

import com.reviewgate.core.model.RunState;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of run records.
 * Every mutation is a compare-and-swap on {@link RunState#version()}.
 */
public interface RunStateRepository {

    /**
     * Find a run by ID.
     *
     * @param runId The run ID
     * @return The run state if found
     * @throws com.reviewgate.core.exception.StateCorruptionException if the stored record cannot be read
     */
    Optional<RunState> get(String runId);

    /**
     * Store a new run. The stored copy carries version 1.
     *
     * @param state The run to store, version 0
     * @return The stored state
     * @throws com.reviewgate.core.exception.StateConflictException if a run with the same ID exists
     */
    RunState create(RunState state);

    /**
     * Replace a run if its stored version still equals {@code expectedVersion}.
     *
     * @param state The new content
     * @param expectedVersion Version the caller read
     * @return The stored state, with version {@code expectedVersion + 1}
     * @throws com.reviewgate.core.exception.StateConflictException if the stored version differs
     * @throws com.reviewgate.core.exception.NotFoundException if the run does not exist
     */
    RunState conditionalPut(RunState state, long expectedVersion);

    /**
     * Claim ownership of a non-terminal run. Succeeds if the run is unowned,
     * its lease expired, or the caller already owns it (renewal).
     *
     * @param runId The run ID
     * @param ownerId The claiming process
     * @param duration Lease duration
     * @return The stored state carrying the new lease
     * @throws com.reviewgate.core.exception.LeaseDeniedException if another owner holds an active lease
     * @throws com.reviewgate.core.exception.NotFoundException if the run does not exist
     */
    RunState leaseClaim(String runId, String ownerId, Duration duration);

    /**
     * Release ownership. A no-op if the lease is held by someone else or absent.
     *
     * @param runId The run ID
     * @param ownerId The releasing process
     * @return true if a lease was released
     */
    boolean leaseRelease(String runId, String ownerId);

    /**
     * Move a run whose record cannot be read to FAILED without reading it.
     * The run loses its lease and becomes subject to retention; its stored
     * document is kept for inspection.
     *
     * @param runId The run ID
     * @param reason Why the record is unreadable
     * @return true if the record changed, false if it is unknown or already settled
     */
    boolean markCorrupt(String runId, String reason);

    /**
     * Find non-terminal runs that nobody currently owns.
     *
     * @param limit Maximum number of results
     * @return Unowned non-terminal runs, oldest update first
     */
    List<RunState> listResumable(int limit);

    /**
     * Find non-terminal runs of a pipeline for the given subject.
     *
     * @param definitionName The pipeline name
     * @param subjectId The change identifier
     * @return Active runs, oldest first
     */
    List<RunState> findActiveBySubject(String definitionName, String subjectId);

    /**
     * Find terminal runs whose compensation did not finish.
     *
     * @param limit Maximum number of results
     * @return BLOCKED or FAILED runs with PENDING or FAILED compensation records
     */
    List<RunState> listTerminalWithPendingCompensation(int limit);

    /**
     * Delete terminal runs completed before the given time.
     * Used for retention.
     *
     * @param completedBefore Delete runs completed before this time
     * @return Number of deleted runs
     */
    int deleteTerminalBefore(Instant completedBefore);
}

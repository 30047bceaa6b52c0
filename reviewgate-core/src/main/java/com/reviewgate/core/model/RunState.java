package com.reviewgate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable record of a single pipeline run.
 * Primary source of truth for run progress; the unit of conditional writes.
 *
 * Primary Key: runId
 *
 * Invariants:
 * - version only advances on a successful conditional write
 * - a task result is recorded at most once
 * - currentStage never regresses
 * - status, results and decision are immutable once terminal;
 *   compensation records may still be appended
 */
public record RunState(
    // Identity
    String runId,
    String definitionName,
    int definitionVersion,
    int schemaVersion,

    // Progress
    RunStatus status,
    int currentStage,
    RunContext context,
    Map<String, TaskResult> results,
    Map<String, PendingTask> pendingTasks,
    List<CompensationRecord> compensationActions,

    // Outcome
    Decision decision,
    String reason,

    // Concurrency
    long version,
    RunLease lease,
    boolean cancelRequested,
    String cancelReason,

    // Timing
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,
    Instant deadline
) {
    /**
     * Schema version written by this build. Records with any other version are rejected on load.
     */
    public static final int CURRENT_SCHEMA_VERSION = 1;

    public RunState {
        results = results != null ? Collections.unmodifiableMap(new LinkedHashMap<>(results)) : Map.of();
        pendingTasks = pendingTasks != null ? Collections.unmodifiableMap(new LinkedHashMap<>(pendingTasks)) : Map.of();
        compensationActions = compensationActions != null ? List.copyOf(compensationActions) : List.of();
    }

    /**
     * Create a new run in CREATED state.
     */
    public static RunState create(
            String runId,
            PipelineDefinition definition,
            RunContext context,
            Instant now,
            Instant deadline) {
        return new RunState(
            runId,
            definition.name(),
            definition.version(),
            CURRENT_SCHEMA_VERSION,
            RunStatus.CREATED,
            0,
            context,
            Map.of(),
            Map.of(),
            List.of(),
            null,
            null,
            0L,
            null,
            false,
            null,
            now,
            now,
            null,
            deadline
        );
    }

    public String definitionRef() {
        return PipelineDefinition.ref(definitionName, definitionVersion);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean hasResult(String taskId) {
        return results.containsKey(taskId);
    }

    /**
     * Whether any process currently owns this run.
     */
    public boolean isLeased(Instant now) {
        return lease != null && lease.isActive(now);
    }

    /**
     * Whether a resumed engine has work to do: not suspended, suspended with
     * every signal already received, or suspended with an expired wait.
     */
    public boolean isResumable(Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        if (status != RunStatus.SUSPENDED || pendingTasks.isEmpty()) {
            return true;
        }
        return pendingTasks.values().stream().anyMatch(p -> p.isExpired(now));
    }

    /**
     * Copy with the given result recorded. A second result for the same task is ignored.
     */
    public RunState withResult(TaskResult result) {
        if (results.containsKey(result.taskId())) {
            return this;
        }
        Map<String, TaskResult> newResults = new LinkedHashMap<>(results);
        newResults.put(result.taskId(), result);
        Map<String, PendingTask> newPending = new LinkedHashMap<>(pendingTasks);
        newPending.remove(result.taskId());
        return toBuilder().results(newResults).pendingTasks(newPending).build();
    }

    public RunState withPending(PendingTask pending) {
        Map<String, PendingTask> newPending = new LinkedHashMap<>(pendingTasks);
        newPending.put(pending.taskId(), pending);
        return toBuilder().pendingTasks(newPending).build();
    }

    /**
     * Copy with the compensation record for the same action replaced, or appended.
     */
    public RunState withCompensation(CompensationRecord record) {
        List<CompensationRecord> updated = new ArrayList<>();
        boolean replaced = false;
        for (CompensationRecord existing : compensationActions) {
            if (existing.actionId().equals(record.actionId())) {
                updated.add(record);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(record);
        }
        return toBuilder().compensationActions(updated).build();
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private String runId;
        private String definitionName;
        private int definitionVersion;
        private int schemaVersion;
        private RunStatus status;
        private int currentStage;
        private RunContext context;
        private Map<String, TaskResult> results;
        private Map<String, PendingTask> pendingTasks;
        private List<CompensationRecord> compensationActions;
        private Decision decision;
        private String reason;
        private long version;
        private RunLease lease;
        private boolean cancelRequested;
        private String cancelReason;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant completedAt;
        private Instant deadline;

        public Builder(RunState state) {
            this.runId = state.runId();
            this.definitionName = state.definitionName();
            this.definitionVersion = state.definitionVersion();
            this.schemaVersion = state.schemaVersion();
            this.status = state.status();
            this.currentStage = state.currentStage();
            this.context = state.context();
            this.results = state.results();
            this.pendingTasks = state.pendingTasks();
            this.compensationActions = state.compensationActions();
            this.decision = state.decision();
            this.reason = state.reason();
            this.version = state.version();
            this.lease = state.lease();
            this.cancelRequested = state.cancelRequested();
            this.cancelReason = state.cancelReason();
            this.createdAt = state.createdAt();
            this.updatedAt = state.updatedAt();
            this.completedAt = state.completedAt();
            this.deadline = state.deadline();
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentStage(int currentStage) {
            this.currentStage = Math.max(this.currentStage, currentStage);
            return this;
        }

        public Builder results(Map<String, TaskResult> results) {
            this.results = results;
            return this;
        }

        public Builder pendingTasks(Map<String, PendingTask> pendingTasks) {
            this.pendingTasks = pendingTasks;
            return this;
        }

        public Builder compensationActions(List<CompensationRecord> compensationActions) {
            this.compensationActions = compensationActions;
            return this;
        }

        public Builder decision(Decision decision) {
            this.decision = decision;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder lease(RunLease lease) {
            this.lease = lease;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested, String cancelReason) {
            this.cancelRequested = cancelRequested;
            this.cancelReason = cancelReason;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public RunState build() {
            return new RunState(
                runId, definitionName, definitionVersion, schemaVersion,
                status, currentStage, context, results, pendingTasks, compensationActions,
                decision, reason, version, lease, cancelRequested, cancelReason,
                createdAt, updatedAt, completedAt, deadline
            );
        }
    }
}

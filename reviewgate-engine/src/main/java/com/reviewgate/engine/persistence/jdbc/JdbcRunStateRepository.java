package com.reviewgate.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reviewgate.core.exception.InvalidStateTransitionException;
import com.reviewgate.core.exception.LeaseDeniedException;
import com.reviewgate.core.exception.NotFoundException;
import com.reviewgate.core.exception.StateConflictException;
import com.reviewgate.core.exception.StateCorruptionException;
import com.reviewgate.core.model.RunLease;
import com.reviewgate.core.model.RunState;
import com.reviewgate.core.repository.RunStateRepository;
import com.reviewgate.engine.persistence.RunStateWriteGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * PostgreSQL-backed implementation of RunStateRepository.
 *
 * Each run is one row holding the full state as a JSONB document plus the
 * columns needed for scans. Writes are compare-and-swap on the version column.
 * Rows with an unknown schema version or an unreadable document raise
 * {@link StateCorruptionException} on direct reads. Scans skip them and move
 * them to FAILED through {@link #markCorrupt(String, String)}, which only
 * touches the scan columns.
 */
public class JdbcRunStateRepository implements RunStateRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunStateRepository.class);

    private static final int MAX_CLAIM_ATTEMPTS = 3;
    private static final String TERMINAL = "('ADMITTED', 'BLOCKED', 'CANCELLED', 'FAILED')";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final RunStateRowMapper rowMapper = new RunStateRowMapper();

    public JdbcRunStateRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<RunState> get(String runId) {
        String sql = "SELECT * FROM run_states WHERE run_id = ?";
        List<RunState> results = jdbcTemplate.query(sql, rowMapper, runId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public RunState create(RunState state) {
        RunState stored = state.toBuilder().version(1L).build();
        String sql = """
            INSERT INTO run_states (
                run_id, definition_name, definition_version, subject_id,
                status, schema_version, version, lease_owner, lease_expires_at,
                compensation_pending, created_at, updated_at, completed_at, document
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
            ON CONFLICT (run_id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            stored.runId(),
            stored.definitionName(),
            stored.definitionVersion(),
            stored.context().subjectId(),
            stored.status().name(),
            stored.schemaVersion(),
            stored.version(),
            leaseOwner(stored),
            leaseExpiry(stored),
            compensationPending(stored),
            toTimestamp(stored.createdAt()),
            toTimestamp(stored.updatedAt()),
            toTimestamp(stored.completedAt()),
            toJson(stored)
        );

        if (rows == 0) {
            throw StateConflictException.duplicate(state.runId());
        }
        return stored;
    }

    @Override
    public RunState conditionalPut(RunState state, long expectedVersion) {
        RunState current = get(state.runId())
            .orElseThrow(() -> new NotFoundException("Run", state.runId()));
        if (current.version() != expectedVersion) {
            throw new StateConflictException(state.runId(), expectedVersion, current.version());
        }
        RunStateWriteGuard.check(current, state);
        return write(state, expectedVersion);
    }

    @Override
    public RunState leaseClaim(String runId, String ownerId, Duration duration) {
        for (int i = 0; i < MAX_CLAIM_ATTEMPTS; i++) {
            RunState current = get(runId).orElseThrow(() -> new NotFoundException("Run", runId));
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
            try {
                return write(current.toBuilder().lease(claimed).build(), current.version());
            } catch (StateConflictException e) {
                log.debug("Lease claim on {} raced with another writer, retrying", runId);
            }
        }
        throw new LeaseDeniedException(runId, "a concurrent claimant");
    }

    @Override
    public boolean leaseRelease(String runId, String ownerId) {
        for (int i = 0; i < MAX_CLAIM_ATTEMPTS; i++) {
            Optional<RunState> found = get(runId);
            if (found.isEmpty()) {
                return false;
            }
            RunState current = found.get();
            if (current.lease() == null || !current.lease().isHeldBy(ownerId)) {
                return false;
            }
            try {
                write(current.toBuilder().lease(null).build(), current.version());
                return true;
            } catch (StateConflictException e) {
                log.debug("Lease release on {} raced with another writer, retrying", runId);
            }
        }
        return false;
    }

    @Override
    public boolean markCorrupt(String runId, String reason) {
        // Terminal rows keep their status; only their pending compensation is dropped
        String sql = """
            UPDATE run_states SET
                status = CASE WHEN status IN %1$s THEN status ELSE 'FAILED' END,
                version = version + 1,
                lease_owner = NULL,
                lease_expires_at = NULL,
                compensation_pending = FALSE,
                failure_reason = ?,
                updated_at = ?,
                completed_at = COALESCE(completed_at, ?)
            WHERE run_id = ?
              AND (status NOT IN %1$s OR compensation_pending = TRUE)
            """.formatted(TERMINAL);
        Timestamp now = toTimestamp(clock.instant());
        int rows = jdbcTemplate.update(sql, reason, now, now, runId);
        if (rows > 0) {
            log.warn("Run {} marked FAILED: {}", runId, reason);
        }
        return rows > 0;
    }

    @Override
    public List<RunState> listResumable(int limit) {
        String sql = """
            SELECT * FROM run_states
            WHERE status NOT IN %s
              AND (lease_expires_at IS NULL OR lease_expires_at <= ?)
            ORDER BY updated_at
            LIMIT ?
            """.formatted(TERMINAL);
        return scan(sql, toTimestamp(clock.instant()), limit);
    }

    @Override
    public List<RunState> findActiveBySubject(String definitionName, String subjectId) {
        String sql = """
            SELECT * FROM run_states
            WHERE definition_name = ? AND subject_id = ?
              AND status NOT IN %s
            ORDER BY created_at
            """.formatted(TERMINAL);
        return scan(sql, definitionName, subjectId);
    }

    @Override
    public List<RunState> listTerminalWithPendingCompensation(int limit) {
        String sql = """
            SELECT * FROM run_states
            WHERE status IN ('BLOCKED', 'FAILED')
              AND compensation_pending = TRUE
            ORDER BY updated_at
            LIMIT ?
            """;
        return scan(sql, limit);
    }

    @Override
    public int deleteTerminalBefore(Instant completedBefore) {
        String sql = """
            DELETE FROM run_states
            WHERE status IN %s
              AND completed_at < ?
            """.formatted(TERMINAL);
        return jdbcTemplate.update(sql, toTimestamp(completedBefore));
    }

    // ========== Helper Methods ==========

    private RunState write(RunState state, long expectedVersion) {
        RunState stored = state.toBuilder().version(expectedVersion + 1).build();
        String sql = """
            UPDATE run_states SET
                status = ?,
                version = ?,
                lease_owner = ?,
                lease_expires_at = ?,
                compensation_pending = ?,
                updated_at = ?,
                completed_at = ?,
                document = ?::jsonb
            WHERE run_id = ? AND version = ?
            """;

        int rows = jdbcTemplate.update(sql,
            stored.status().name(),
            stored.version(),
            leaseOwner(stored),
            leaseExpiry(stored),
            compensationPending(stored),
            toTimestamp(stored.updatedAt()),
            toTimestamp(stored.completedAt()),
            toJson(stored),
            stored.runId(),
            expectedVersion
        );

        if (rows == 0) {
            throw StateConflictException.lostRace(state.runId(), expectedVersion);
        }
        return stored;
    }

    /**
     * Query rows, skipping unreadable ones. Skipped rows are marked corrupt once
     * the result set is closed.
     */
    private List<RunState> scan(String sql, Object... args) {
        Map<String, String> corrupt = new LinkedHashMap<>();
        List<RunState> rows = jdbcTemplate.query(sql, (rs, rowNum) -> {
            try {
                return rowMapper.mapRow(rs, rowNum);
            } catch (StateCorruptionException e) {
                log.error("Skipping unreadable run record {}: {}", e.getRunId(), e.getMessage());
                corrupt.put(e.getRunId(), e.getMessage());
                return null;
            }
        }, args);
        corrupt.forEach(this::markCorrupt);
        return rows.stream().filter(Objects::nonNull).collect(Collectors.toList());
    }

    private String toJson(RunState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize run " + state.runId(), e);
        }
    }

    private static String leaseOwner(RunState state) {
        return state.lease() != null ? state.lease().ownerId() : null;
    }

    private static Timestamp leaseExpiry(RunState state) {
        return state.lease() != null ? toTimestamp(state.lease().expiresAt()) : null;
    }

    private static boolean compensationPending(RunState state) {
        return state.compensationActions().stream().anyMatch(c -> !c.isDone());
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class RunStateRowMapper implements RowMapper<RunState> {
        @Override
        public RunState mapRow(ResultSet rs, int rowNum) throws SQLException {
            String runId = rs.getString("run_id");
            int schemaVersion = rs.getInt("schema_version");
            if (schemaVersion != RunState.CURRENT_SCHEMA_VERSION) {
                throw new StateCorruptionException(runId,
                    "unsupported schema version " + schemaVersion);
            }
            RunState state;
            try {
                state = objectMapper.readValue(rs.getString("document"), RunState.class);
            } catch (JsonProcessingException e) {
                throw new StateCorruptionException(runId, "unreadable document", e);
            }
            if (state.schemaVersion() != RunState.CURRENT_SCHEMA_VERSION || !runId.equals(state.runId())) {
                throw new StateCorruptionException(runId, "document does not match its row");
            }
            return state.toBuilder().version(rs.getLong("version")).build();
        }
    }
}

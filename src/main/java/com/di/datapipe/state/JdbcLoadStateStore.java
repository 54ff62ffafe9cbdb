package com.di.datapipe.state;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC marker store for the {@code load_state} table (PostgreSQL). Shared by every loader instance,
 * so dependency checks see the same markers regardless of which instance ran the load.
 * Each operation is a single statement; completion is a compare-and-set on {@code latest_job_id}.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcLoadStateStore implements LoadStateStore {

    private final JdbcTemplate jdbc;

    // ------------------------------------------------------------------
    // RowMapper
    // ------------------------------------------------------------------

    private static final RowMapper<TableLoadMarker> ROW_MAPPER = (rs, n) -> {
        long rows = rs.getLong("row_count");
        Long rowCount = rs.wasNull() ? null : rows;
        return TableLoadMarker.builder()
                .table(rs.getString("table_name"))
                .latestJobId(rs.getString("latest_job_id"))
                .status(LoadStatus.valueOf(rs.getString("status")))
                .version(rs.getLong("version"))
                .rowCount(rowCount)
                .completedJobId(rs.getString("completed_job_id"))
                .errorMessage(rs.getString("error_message"))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    };

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    @Override
    public void beginAttempt(String table, String jobId, Instant at) {
        jdbc.update("""
            INSERT INTO load_state (table_name, latest_job_id, status, version, updated_at)
            VALUES (?, ?, 'RUNNING', 0, ?)
            ON CONFLICT (table_name) DO UPDATE
               SET latest_job_id = EXCLUDED.latest_job_id,
                   status        = 'RUNNING',
                   error_message = NULL,
                   updated_at    = EXCLUDED.updated_at
            """, table, jobId, Timestamp.from(at));
    }

    @Override
    public boolean markCompleted(String table, String jobId, long rowCount, Instant at) {
        int updated = jdbc.update("""
            UPDATE load_state
               SET status           = 'COMPLETED',
                   version          = version + 1,
                   row_count        = ?,
                   completed_job_id = latest_job_id,
                   completed_at     = ?,
                   updated_at       = ?
             WHERE table_name = ? AND latest_job_id = ?
            """, rowCount, Timestamp.from(at), Timestamp.from(at), table, jobId);
        if (updated == 0) {
            log.info("[STATE] completion of {} on {} superseded by a newer attempt", jobId, table);
        }
        return updated == 1;
    }

    @Override
    public boolean markFailed(String table, String jobId, String errorMessage, Instant at) {
        int updated = jdbc.update("""
            UPDATE load_state
               SET status = 'FAILED', error_message = ?, updated_at = ?
             WHERE table_name = ? AND latest_job_id = ?
            """, errorMessage, Timestamp.from(at), table, jobId);
        return updated == 1;
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    @Override
    public Optional<TableLoadMarker> find(String table) {
        List<TableLoadMarker> rows = jdbc.query(
                "SELECT * FROM load_state WHERE table_name = ?", ROW_MAPPER, table);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<TableLoadMarker> findAll() {
        return jdbc.query("SELECT * FROM load_state ORDER BY table_name", ROW_MAPPER);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}

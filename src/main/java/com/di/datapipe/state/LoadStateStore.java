package com.di.datapipe.state;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-table completion markers. Every update is atomic per table; completion and failure only apply
 * to the table's most recent attempt.
 */
public interface LoadStateStore {

    /** Records {@code jobId} as the table's most recent attempt, status RUNNING. */
    void beginAttempt(String table, String jobId, Instant at);

    /**
     * Marks {@code jobId} completed and bumps the version.
     *
     * @return false when a newer attempt has superseded {@code jobId}; the marker is left unchanged
     */
    boolean markCompleted(String table, String jobId, long rowCount, Instant at);

    /**
     * @return false when a newer attempt has superseded {@code jobId}
     */
    boolean markFailed(String table, String jobId, String errorMessage, Instant at);

    Optional<TableLoadMarker> find(String table);

    List<TableLoadMarker> findAll();
}

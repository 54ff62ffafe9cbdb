package com.di.datapipe.state;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Completion marker for one warehouse table. {@code status} describes the table's most recent load
 * attempt ({@code latestJobId}); {@code version} counts completed loads and only moves forward.
 *
 * <pre>Status flow per attempt:
 *   RUNNING → COMPLETED   (version + 1)
 *   RUNNING → FAILED
 *   (a newer attempt supersedes an older one; the older one can no longer change the marker)
 * </pre>
 */
@Value
@Builder(toBuilder = true)
public class TableLoadMarker {

    String table;

    String latestJobId;

    LoadStatus status;

    long version;

    Long rowCount;

    String completedJobId;

    String errorMessage;

    Instant updatedAt;

    Instant completedAt;

    public boolean isCompleted() {
        return status == LoadStatus.COMPLETED;
    }
}

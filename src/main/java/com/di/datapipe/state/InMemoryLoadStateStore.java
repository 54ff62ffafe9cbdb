package com.di.datapipe.state;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory marker store. Suitable for the local runtime and a single instance.
 * When datapipe.state.store=jdbc, JdbcLoadStateStore is used instead.
 */
@Slf4j
public class InMemoryLoadStateStore implements LoadStateStore {

    private final ConcurrentMap<String, TableLoadMarker> markers = new ConcurrentHashMap<>();

    @Override
    public void beginAttempt(String table, String jobId, Instant at) {
        markers.compute(table, (t, existing) -> {
            TableLoadMarker.TableLoadMarkerBuilder b = existing == null
                    ? TableLoadMarker.builder().table(t)
                    : existing.toBuilder();
            return b.latestJobId(jobId)
                    .status(LoadStatus.RUNNING)
                    .errorMessage(null)
                    .updatedAt(at)
                    .build();
        });
    }

    @Override
    public boolean markCompleted(String table, String jobId, long rowCount, Instant at) {
        AtomicBoolean applied = new AtomicBoolean();
        markers.computeIfPresent(table, (t, existing) -> {
            if (!jobId.equals(existing.getLatestJobId())) {
                return existing;
            }
            applied.set(true);
            return existing.toBuilder()
                    .status(LoadStatus.COMPLETED)
                    .version(existing.getVersion() + 1)
                    .rowCount(rowCount)
                    .completedJobId(jobId)
                    .completedAt(at)
                    .updatedAt(at)
                    .build();
        });
        if (!applied.get()) {
            log.info("[STATE] completion of {} on {} superseded by a newer attempt", jobId, table);
        }
        return applied.get();
    }

    @Override
    public boolean markFailed(String table, String jobId, String errorMessage, Instant at) {
        AtomicBoolean applied = new AtomicBoolean();
        markers.computeIfPresent(table, (t, existing) -> {
            if (!jobId.equals(existing.getLatestJobId())) {
                return existing;
            }
            applied.set(true);
            return existing.toBuilder()
                    .status(LoadStatus.FAILED)
                    .errorMessage(errorMessage)
                    .updatedAt(at)
                    .build();
        });
        return applied.get();
    }

    @Override
    public Optional<TableLoadMarker> find(String table) {
        return Optional.ofNullable(markers.get(table));
    }

    @Override
    public List<TableLoadMarker> findAll() {
        List<TableLoadMarker> out = new ArrayList<>(markers.values());
        out.sort(Comparator.comparing(TableLoadMarker::getTable));
        return out;
    }
}

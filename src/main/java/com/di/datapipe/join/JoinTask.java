package com.di.datapipe.join;

import lombok.Getter;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One attempt at building a derived table. State changes are compare-and-set, so a task moves
 * through each state at most once.
 */
public class JoinTask {

    @Getter
    private final String id;
    @Getter
    private final String joinName;
    @Getter
    private final Instant createdAt;

    private final AtomicReference<JoinState> state = new AtomicReference<>(JoinState.PENDING);

    @Getter
    private volatile Map<String, Long> inputVersions = Map.of();
    @Getter
    private volatile Instant startedAt;
    @Getter
    private volatile Instant finishedAt;
    @Getter
    private volatile Long rowCount;
    @Getter
    private volatile String error;
    private volatile boolean staleReported;

    public JoinTask(String id, String joinName, Instant createdAt) {
        this.id = id;
        this.joinName = joinName;
        this.createdAt = createdAt;
    }

    public JoinState getState() {
        return state.get();
    }

    boolean transition(JoinState from, JoinState to) {
        return state.compareAndSet(from, to);
    }

    boolean start(Map<String, Long> versions, Instant at) {
        if (!transition(JoinState.READY, JoinState.RUNNING)) {
            return false;
        }
        this.inputVersions = Map.copyOf(versions);
        this.startedAt = at;
        return true;
    }

    boolean complete(long rows, Instant at) {
        if (!transition(JoinState.RUNNING, JoinState.COMPLETED)) {
            return false;
        }
        this.rowCount = rows;
        this.finishedAt = at;
        return true;
    }

    boolean fail(String reason, Instant at) {
        if (!transition(JoinState.RUNNING, JoinState.FAILED)) {
            return false;
        }
        this.error = reason;
        this.finishedAt = at;
        return true;
    }

    /** True exactly once: the first time the caller reports this task as stale. */
    boolean markStaleReported() {
        if (staleReported) {
            return false;
        }
        staleReported = true;
        return true;
    }

    public JoinTaskSnapshot snapshot() {
        return JoinTaskSnapshot.builder()
                .id(id)
                .join(joinName)
                .state(getState())
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .inputVersions(inputVersions)
                .rowCount(rowCount)
                .error(error)
                .build();
    }
}

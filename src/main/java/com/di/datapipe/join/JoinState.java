package com.di.datapipe.join;

/**
 * <pre>
 *   PENDING ──(all dependencies COMPLETED)──► READY ──► RUNNING ──► COMPLETED
 *                                                          └──────► FAILED
 * </pre>
 */
public enum JoinState {
    PENDING,
    READY,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}

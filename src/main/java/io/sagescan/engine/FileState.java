package io.sagescan.engine;

/**
 * Lifecycle of a single file within a run.
 * Every file moves PENDING, ANALYZING, then exactly one of SUCCEEDED or FAILED.
 */
public enum FileState {
    PENDING,
    ANALYZING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}

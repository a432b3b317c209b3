package com.batchinsight.shared.model;

/**
 * Per-document job states.
 */
public enum JobStatus {
    QUEUED,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED_RETRYABLE,
    FAILED_TERMINAL;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_TERMINAL;
    }
}

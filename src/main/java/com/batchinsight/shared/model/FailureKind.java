package com.batchinsight.shared.model;

/**
 * Error classes a job attempt can end with.
 */
public enum FailureKind {
    TIMEOUT(true),
    TRANSIENT(true),
    REJECTED(false),
    MALFORMED(false),
    CANCELLED(false),
    BATCH_TIMEOUT(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

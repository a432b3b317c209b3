package com.batchinsight.processing;

import com.batchinsight.shared.model.FailureKind;

/**
 * Error returned by the analysis capability. Only TIMEOUT, TRANSIENT and REJECTED are valid kinds.
 */
public class AnalysisException extends Exception {

    private final FailureKind kind;

    public AnalysisException(FailureKind kind, String message) {
        this(kind, message, null);
    }

    public AnalysisException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind != FailureKind.TIMEOUT && kind != FailureKind.TRANSIENT && kind != FailureKind.REJECTED) {
            throw new IllegalArgumentException("Unsupported analysis failure kind: " + kind);
        }
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}

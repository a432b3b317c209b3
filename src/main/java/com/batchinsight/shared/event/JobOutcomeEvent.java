package com.batchinsight.shared.event;

import com.batchinsight.shared.model.FailureKind;

import java.util.Objects;
import java.util.UUID;

/**
 * Terminal result of one job attempt chain, published by workers and by the
 * queue when it dead-letters a message. Consumed synchronously by the orchestrator.
 */
public final class JobOutcomeEvent {

    private final UUID batchId;
    private final UUID jobId;
    private final String documentReference;
    private final boolean succeeded;
    private final String verdict;
    private final Double confidenceScore;
    private final FailureKind failureKind;
    private final String errorMessage;
    private final int attempts;

    private JobOutcomeEvent(UUID batchId, UUID jobId, String documentReference, boolean succeeded,
                            String verdict, Double confidenceScore, FailureKind failureKind,
                            String errorMessage, int attempts) {
        this.batchId = Objects.requireNonNull(batchId, "batchId");
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.documentReference = documentReference;
        this.succeeded = succeeded;
        this.verdict = verdict;
        this.confidenceScore = confidenceScore;
        this.failureKind = failureKind;
        this.errorMessage = errorMessage;
        this.attempts = attempts;
    }

    public static JobOutcomeEvent success(UUID batchId, UUID jobId, String documentReference,
                                          String verdict, Double confidenceScore, int attempts) {
        return new JobOutcomeEvent(batchId, jobId, documentReference, true, verdict, confidenceScore,
                null, null, attempts);
    }

    public static JobOutcomeEvent failure(UUID batchId, UUID jobId, String documentReference,
                                          FailureKind kind, String errorMessage, int attempts) {
        return new JobOutcomeEvent(batchId, jobId, documentReference, false, null, null,
                Objects.requireNonNull(kind, "kind"), errorMessage, attempts);
    }

    public UUID getBatchId() {
        return batchId;
    }

    public UUID getJobId() {
        return jobId;
    }

    public String getDocumentReference() {
        return documentReference;
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    public String getVerdict() {
        return verdict;
    }

    public Double getConfidenceScore() {
        return confidenceScore;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return "JobOutcomeEvent{batchId=" + batchId + ", jobId=" + jobId + ", succeeded=" + succeeded
                + ", failureKind=" + failureKind + ", attempts=" + attempts + "}";
    }
}

package com.batchinsight.observability;

import com.batchinsight.shared.model.BatchStatus;
import com.batchinsight.shared.model.FailureKind;
import com.batchinsight.shared.model.QueueTier;

import java.util.function.Supplier;

/**
 * Interface for batch metrics to support both enabled and disabled modes.
 */
public interface BatchMetricsServiceInterface {
    void recordBatchSubmitted(QueueTier tier);
    void recordBatchCompleted(BatchStatus status);
    void recordJobSuccess(QueueTier tier, long durationMs);
    void recordJobFailure(QueueTier tier, FailureKind kind);
    void recordRetry(QueueTier tier, FailureKind kind);
    void recordDeadLetter(QueueTier tier, String reason);
    void registerQueueDepthGauge(QueueTier tier, Supplier<Number> depth);
}

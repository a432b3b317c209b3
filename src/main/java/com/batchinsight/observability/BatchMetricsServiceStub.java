package com.batchinsight.observability;

import com.batchinsight.shared.model.BatchStatus;
import com.batchinsight.shared.model.FailureKind;
import com.batchinsight.shared.model.QueueTier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * No-op implementation when app.metrics.enabled=false.
 */
@Service
@ConditionalOnProperty(name = "app.metrics.enabled", havingValue = "false")
public class BatchMetricsServiceStub implements BatchMetricsServiceInterface {

    @Override
    public void recordBatchSubmitted(QueueTier tier) {
    }

    @Override
    public void recordBatchCompleted(BatchStatus status) {
    }

    @Override
    public void recordJobSuccess(QueueTier tier, long durationMs) {
    }

    @Override
    public void recordJobFailure(QueueTier tier, FailureKind kind) {
    }

    @Override
    public void recordRetry(QueueTier tier, FailureKind kind) {
    }

    @Override
    public void recordDeadLetter(QueueTier tier, String reason) {
    }

    @Override
    public void registerQueueDepthGauge(QueueTier tier, Supplier<Number> depth) {
    }
}

package com.batchinsight.observability;

import com.batchinsight.shared.model.BatchStatus;
import com.batchinsight.shared.model.FailureKind;
import com.batchinsight.shared.model.QueueTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer metrics for batches, jobs and queues. Exposed through actuator and,
 * when datadog.enabled=true, shipped to DogStatsD by the composite registry.
 *
 * Metrics:
 * - batchinsight.batch.submitted: Counter of accepted batches, by tier
 * - batchinsight.batch.completed: Counter of terminal batches, by status
 * - batchinsight.job.duration: Timer for successful job processing
 * - batchinsight.job.success / batchinsight.job.failure: job outcome counters
 * - batchinsight.job.retry: Counter of redeliveries scheduled after a retryable failure
 * - batchinsight.queue.dead_letter: Counter of dead-lettered messages
 * - batchinsight.queue.depth: Gauge of visible messages per tier
 */
@Service
@ConditionalOnProperty(name = "app.metrics.enabled", havingValue = "true", matchIfMissing = true)
public class BatchMetricsService implements BatchMetricsServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(BatchMetricsService.class);
    private static final String SERVICE = "batch-insight";

    private final MeterRegistry meterRegistry;

    public BatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordBatchSubmitted(QueueTier tier) {
        Counter.builder("batchinsight.batch.submitted")
                .description("Number of accepted batches")
                .tag("service", SERVICE)
                .tag("tier", tag(tier))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordBatchCompleted(BatchStatus status) {
        Counter.builder("batchinsight.batch.completed")
                .description("Number of batches that reached a terminal state")
                .tag("service", SERVICE)
                .tag("status", status != null ? status.name() : "unknown")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded batch completion with status={}", status);
    }

    @Override
    public void recordJobSuccess(QueueTier tier, long durationMs) {
        Counter.builder("batchinsight.job.success")
                .tag("service", SERVICE)
                .tag("tier", tag(tier))
                .register(meterRegistry)
                .increment();
        Timer.builder("batchinsight.job.duration")
                .description("Job processing duration")
                .tag("service", SERVICE)
                .tag("tier", tag(tier))
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordJobFailure(QueueTier tier, FailureKind kind) {
        Counter.builder("batchinsight.job.failure")
                .tag("service", SERVICE)
                .tag("tier", tag(tier))
                .tag("error_type", kind != null ? kind.name() : "unknown")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordRetry(QueueTier tier, FailureKind kind) {
        Counter.builder("batchinsight.job.retry")
                .tag("service", SERVICE)
                .tag("tier", tag(tier))
                .tag("error_type", kind != null ? kind.name() : "unknown")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordDeadLetter(QueueTier tier, String reason) {
        Counter.builder("batchinsight.queue.dead_letter")
                .description("Number of messages moved to a dead-letter queue")
                .tag("service", SERVICE)
                .tag("tier", tag(tier))
                .tag("reason", reason != null ? reason : "unknown")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void registerQueueDepthGauge(QueueTier tier, Supplier<Number> depth) {
        Gauge.builder("batchinsight.queue.depth", () -> {
                    try {
                        return depth.get();
                    } catch (RuntimeException e) {
                        logger.warn("Failed to read depth of {}: {}", tier.queueName(), e.getMessage());
                        return 0;
                    }
                })
                .description("Number of visible messages in the tier queue")
                .tag("service", SERVICE)
                .tag("tier", tag(tier))
                .register(meterRegistry);
    }

    private static String tag(QueueTier tier) {
        return tier != null ? tier.name().toLowerCase(Locale.ROOT) : "unknown";
    }
}

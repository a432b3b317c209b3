package com.batchinsight.orchestration;

import com.batchinsight.observability.BatchMetricsServiceInterface;
import com.batchinsight.queue.PermanentQueueException;
import com.batchinsight.queue.TransientQueueException;
import com.batchinsight.shared.dto.AggregateResult;
import com.batchinsight.shared.dto.SubmitBatchRequest;
import com.batchinsight.shared.event.JobOutcomeEvent;
import com.batchinsight.shared.exception.OrchestratorInfrastructureException;
import com.batchinsight.shared.model.Batch;
import com.batchinsight.shared.model.BatchStatus;
import com.batchinsight.util.MdcKeys;
import com.batchinsight.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Drives batches through their lifecycle. Job outcomes arrive as {@link JobOutcomeEvent}s on the
 * publishing worker's thread; the batch that completes is finalized and its notification emitted.
 */
@Service
public class BatchOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final BatchLifecycleService lifecycleService;
    private final Aggregator aggregator;
    private final BatchErrorHandler errorHandler;
    private final BatchNotificationService notificationService;
    private final BatchMetricsServiceInterface metricsService;
    private final int maxPrepareAttempts;

    public BatchOrchestrator(BatchLifecycleService lifecycleService,
                             Aggregator aggregator,
                             BatchErrorHandler errorHandler,
                             BatchNotificationService notificationService,
                             BatchMetricsServiceInterface metricsService,
                             @Value("${app.batch.max-prepare-attempts:3}") int maxPrepareAttempts) {
        this.lifecycleService = lifecycleService;
        this.aggregator = aggregator;
        this.errorHandler = errorHandler;
        this.notificationService = notificationService;
        this.metricsService = metricsService;
        this.maxPrepareAttempts = maxPrepareAttempts;
    }

    /**
     * Accepts a batch. Preparation happens asynchronously on the preparation poller.
     *
     * @throws com.batchinsight.shared.exception.BatchValidationException if the request is invalid
     * @throws OrchestratorInfrastructureException if the batch could not be stored
     */
    public Batch submit(SubmitBatchRequest request) {
        Batch batch;
        try {
            batch = lifecycleService.submit(request);
        } catch (DataAccessException e) {
            throw new OrchestratorInfrastructureException("Batch store unavailable", e);
        }
        metricsService.recordBatchSubmitted(batch.getPriority());
        return batch;
    }

    /**
     * Prepares one PENDING batch. Transient queue errors leave the batch PENDING for the next
     * poll until the attempt limit is reached; any other error fails the batch.
     */
    public void prepare(UUID batchId) {
        MDC.put(MdcKeys.BATCH_ID, batchId.toString());
        try {
            Optional<BatchStatus> status = lifecycleService.prepare(batchId);
            if (status.isPresent() && status.get().isTerminal()) {
                metricsService.recordBatchCompleted(status.get());
                notificationService.notifyIfPending(batchId);
            }
        } catch (TransientQueueException | DataAccessException e) {
            int attempts = errorHandler.recordPrepareFailure(batchId, "Queue unavailable: " + Strings.describe(e));
            if (attempts >= maxPrepareAttempts) {
                failBatch(batchId, "Preparation failed after " + attempts + " attempt(s): " + Strings.describe(e));
            }
        } catch (PermanentQueueException e) {
            failBatch(batchId, "Job message rejected by queue: " + Strings.describe(e));
        } catch (RuntimeException e) {
            logger.error("Unexpected error preparing batch {}", batchId, e);
            failBatch(batchId, "Preparation failed: " + Strings.describe(e));
        } finally {
            MDC.remove(MdcKeys.BATCH_ID);
        }
    }

    @EventListener
    public void onJobOutcome(JobOutcomeEvent event) {
        if (aggregator.recordOutcome(event)) {
            finalizeBatch(event.getBatchId());
        }
    }

    /**
     * Resolves an AGGREGATING batch and emits its notification. Errors force the batch FAILED.
     */
    public Optional<AggregateResult> finalizeBatch(UUID batchId) {
        MDC.put(MdcKeys.BATCH_ID, batchId.toString());
        try {
            AggregateResult result = aggregator.finalizeBatch(batchId);
            metricsService.recordBatchCompleted(BatchStatus.valueOf(result.getStatus()));
            logger.info("Batch {} finished {}: {} succeeded, {} failed", batchId, result.getStatus(),
                    result.getSucceeded(), result.getFailed());
            return Optional.of(result);
        } catch (RuntimeException e) {
            logger.error("Aggregation of batch {} failed", batchId, e);
            failBatch(batchId, "Aggregation failed: " + Strings.describe(e));
            return Optional.empty();
        } finally {
            notifySafely(batchId);
            MDC.remove(MdcKeys.BATCH_ID);
        }
    }

    /**
     * Cancels a batch. In-flight jobs notice on their next retry decision.
     */
    public Batch cancel(UUID batchId) {
        Batch batch = lifecycleService.cancel(batchId);
        metricsService.recordBatchCompleted(batch.getStatus());
        notifySafely(batchId);
        return batch;
    }

    /**
     * Expires a RUNNING batch past its deadline and finalizes it as TIMED_OUT.
     */
    public boolean timeOut(UUID batchId) {
        boolean expired;
        try {
            expired = lifecycleService.expire(batchId);
        } catch (RuntimeException e) {
            logger.error("Expiring batch {} failed", batchId, e);
            failBatch(batchId, "Deadline handling failed: " + Strings.describe(e));
            return false;
        }
        if (expired) {
            finalizeBatch(batchId);
        }
        return expired;
    }

    private void failBatch(UUID batchId, String error) {
        try {
            if (errorHandler.forceFailed(batchId, error)) {
                metricsService.recordBatchCompleted(BatchStatus.FAILED);
                notifySafely(batchId);
            }
        } catch (RuntimeException e) {
            logger.error("Could not record failure of batch {}", batchId, e);
        }
    }

    private void notifySafely(UUID batchId) {
        try {
            notificationService.notifyIfPending(batchId);
        } catch (RuntimeException e) {
            logger.warn("Notification for batch {} deferred: {}", batchId, Strings.describe(e));
        }
    }
}

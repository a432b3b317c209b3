package com.batchinsight.orchestration;

import com.batchinsight.messaging.BatchNotification;
import com.batchinsight.messaging.BatchNotificationPublisher;
import com.batchinsight.messaging.NotificationException;
import com.batchinsight.shared.model.Batch;
import com.batchinsight.shared.repository.BatchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Emits the completion notification of a terminal batch. {@code notified_at} is only set after
 * a successful publish, so a failed publish is retried by the deadline monitor's sweep.
 */
@Service
public class BatchNotificationService {

    private static final Logger logger = LoggerFactory.getLogger(BatchNotificationService.class);

    private final BatchRepository batchRepository;
    private final BatchNotificationPublisher publisher;

    public BatchNotificationService(BatchRepository batchRepository, BatchNotificationPublisher publisher) {
        this.batchRepository = batchRepository;
        this.publisher = publisher;
    }

    /**
     * Publishes the notification if the batch is terminal and not yet notified.
     *
     * @return true if a notification was published by this call
     */
    @Transactional
    public boolean notifyIfPending(UUID batchId) {
        Optional<Batch> locked = batchRepository.findByBatchUuidForUpdate(batchId);
        if (locked.isEmpty()) {
            return false;
        }
        Batch batch = locked.get();
        if (!batch.getStatus().isTerminal() || batch.getNotifiedAt() != null) {
            return false;
        }
        String summary = batch.getResultSummary() != null ? batch.getResultSummary() : batch.getErrorMessage();
        BatchNotification notification = new BatchNotification(batch.getBatchUuid(), batch.getOwner(),
                batch.getStatus().name(), summary, batch.getSucceededCount(), batch.getFailedCount(),
                batch.getCompletedAt());
        try {
            publisher.publish(notification);
        } catch (NotificationException e) {
            logger.warn("Notification for batch {} failed, will retry: {}", batchId, e.getMessage());
            return false;
        }
        batchRepository.markNotified(batchId, Instant.now());
        return true;
    }
}

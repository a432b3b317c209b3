package com.batchinsight.queue;

import com.batchinsight.observability.BatchMetricsServiceInterface;
import com.batchinsight.shared.event.JobOutcomeEvent;
import com.batchinsight.shared.model.DeadLetterEntry;
import com.batchinsight.shared.model.QueueTier;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed priority queue set. Holds one {@link TierQueue} per tier; all tiers share
 * the queue_messages table and are told apart by queue name.
 */
@Service
public class DatabasePriorityQueueSet implements PriorityQueueSet {

    private static final Logger logger = LoggerFactory.getLogger(DatabasePriorityQueueSet.class);

    private final QueueMessageStore store;
    private final ApplicationEventPublisher eventPublisher;
    private final BatchMetricsServiceInterface metricsService;
    private final Duration pollInterval;
    private final Map<QueueTier, TierQueue> tiers = new EnumMap<>(QueueTier.class);

    public DatabasePriorityQueueSet(QueueMessageStore store,
                                    QueueProperties properties,
                                    ApplicationEventPublisher eventPublisher,
                                    BatchMetricsServiceInterface metricsService) {
        this.store = store;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.pollInterval = properties.getPollInterval();
        for (QueueTier tier : QueueTier.values()) {
            TierPolicy policy = properties.policyFor(tier);
            tiers.put(tier, new TierQueue(policy, store, pollInterval, this::onExpired));
            logger.info("Configured queue {}: {}", tier.queueName(), policy);
        }
    }

    @PostConstruct
    void registerGauges() {
        for (QueueTier tier : QueueTier.values()) {
            metricsService.registerQueueDepthGauge(tier, () -> depth(tier));
        }
    }

    @Override
    public UUID enqueue(QueueMessage message, QueueTier priority) {
        if (priority == null) {
            throw new PermanentQueueException("Priority is required");
        }
        message.setPriority(priority);
        return store.enqueue(priority, message, Instant.now());
    }

    @Override
    public List<ReceivedMessage> dequeue(QueueTier tier, int maxBatch, Duration waitTimeout) {
        return tiers.get(tier).receive(maxBatch, waitTimeout);
    }

    @Override
    public List<ReceivedMessage> dequeueNext(Duration waitTimeout) {
        Instant deadline = Instant.now().plus(waitTimeout);
        while (true) {
            for (QueueTier tier : QueueTier.values()) {
                TierQueue queue = tiers.get(tier);
                List<ReceivedMessage> first = queue.poll(1);
                if (!first.isEmpty()) {
                    int batchSize = queue.getPolicy().getBatchSize();
                    if (batchSize == 1) {
                        return first;
                    }
                    List<ReceivedMessage> collected = new ArrayList<>(first);
                    collected.addAll(queue.receive(batchSize - 1, queue.getPolicy().getBatchingDelay()));
                    return collected;
                }
            }
            Instant now = Instant.now();
            if (!now.isBefore(deadline)) {
                return List.of();
            }
            Duration remaining = Duration.between(now, deadline);
            try {
                Thread.sleep(Math.max(1L, Math.min(pollInterval.toMillis(), remaining.toMillis())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            }
        }
    }

    @Override
    public boolean acknowledge(UUID receiptHandle) {
        boolean removed = store.acknowledge(receiptHandle);
        if (!removed) {
            logger.debug("Acknowledge with stale receipt handle {} ignored", receiptHandle);
        }
        return removed;
    }

    @Override
    public boolean release(UUID receiptHandle, Duration delay, FailureRecord failure) {
        return store.release(receiptHandle, delay, failure);
    }

    @Override
    public Optional<DeadLetterEntry> deadLetter(UUID receiptHandle, String reason, FailureRecord failure) {
        Optional<DeadLetterEntry> entry = store.deadLetter(receiptHandle, reason, failure);
        entry.ifPresent(e -> metricsService.recordDeadLetter(e.getTier(), reason));
        return entry;
    }

    @Override
    public int purgeBatch(UUID batchId) {
        int purged = store.purgeBatch(batchId);
        if (purged > 0) {
            logger.info("Purged {} outstanding message(s) of batch {}", purged, batchId);
        }
        return purged;
    }

    @Override
    public long depth(QueueTier tier) {
        return store.countVisible(tier);
    }

    @Override
    public TierPolicy policy(QueueTier tier) {
        return tiers.get(tier).getPolicy();
    }

    @Override
    public boolean returnUnstarted(UUID receiptHandle) {
        return store.returnUnstarted(receiptHandle);
    }

    /**
     * Messages the queue stops redelivering (redelivery ceiling or undecodable body) still owe
     * their batch a failed outcome. The outcome is recorded first; a message whose outcome could
     * not be recorded stays where it is and expires again after the visibility timeout.
     */
    void onExpired(List<ExpiredMessage> expired) {
        for (ExpiredMessage message : expired) {
            FailureRecord failure = message.getFailure();
            JobOutcomeEvent event = JobOutcomeEvent.failure(message.getBatchId(), message.getJobId(),
                    message.getDocumentReference(), failure.getKind(),
                    "Dead-lettered to " + message.getTier().deadLetterQueueName() + ": " + failure.getMessage(),
                    message.getAttemptCount());
            try {
                eventPublisher.publishEvent(event);
            } catch (RuntimeException e) {
                logger.error("Failed to record outcome for expired job {} of batch {}; it stays on {} until "
                                + "the visibility timeout", message.getJobId(), message.getBatchId(),
                        message.getTier().queueName(), e);
                continue;
            }
            if (deadLetter(message.getReceiptHandle(), message.getReason(), failure).isEmpty()) {
                logger.warn("Expired job {} was removed before it could be dead-lettered", message.getJobId());
            }
        }
    }
}

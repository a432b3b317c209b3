package com.batchinsight.queue;

import com.batchinsight.shared.model.DeadLetterEntry;
import com.batchinsight.shared.model.FailureKind;
import com.batchinsight.shared.model.QueueMessageRecord;
import com.batchinsight.shared.model.QueueTier;
import com.batchinsight.shared.repository.DeadLetterEntryRepository;
import com.batchinsight.shared.repository.QueueMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional primitives behind the tier queues. Every method runs in its own
 * transaction, or joins the caller's (enqueue during batch preparation).
 * This is a separate bean to avoid @Transactional self-invocation.
 */
@Service
public class QueueMessageStore {

    private static final Logger logger = LoggerFactory.getLogger(QueueMessageStore.class);

    static final String REASON_MAX_RECEIVES = "MAX_RECEIVE_COUNT_EXCEEDED";
    static final String REASON_MALFORMED = "MALFORMED_MESSAGE";

    private final QueueMessageRepository queueMessageRepository;
    private final DeadLetterEntryRepository deadLetterEntryRepository;
    private final QueueMessageCodec codec;

    public QueueMessageStore(QueueMessageRepository queueMessageRepository,
                             DeadLetterEntryRepository deadLetterEntryRepository,
                             QueueMessageCodec codec) {
        this.queueMessageRepository = queueMessageRepository;
        this.deadLetterEntryRepository = deadLetterEntryRepository;
        this.codec = codec;
    }

    /**
     * Writes a message row that becomes visible at {@code visibleAt}.
     *
     * @return the message id
     */
    @Transactional
    public UUID enqueue(QueueTier tier, QueueMessage message, Instant visibleAt) {
        String payload = codec.encode(message);
        QueueMessageRecord record = new QueueMessageRecord();
        record.setQueueName(tier.queueName());
        record.setJobUuid(message.getJobId());
        record.setBatchUuid(message.getBatchId());
        record.setPayload(payload);
        record.setEnqueuedAt(Instant.now());
        record.setVisibleAt(visibleAt);
        try {
            queueMessageRepository.save(record);
        } catch (DataAccessException e) {
            throw new TransientQueueException("Queue " + tier.queueName() + " did not accept message for job "
                    + message.getJobId(), e);
        }
        logger.debug("Enqueued message {} for job {} on {}", record.getMessageUuid(), message.getJobId(),
                tier.queueName());
        return record.getMessageUuid();
    }

    /**
     * Receives up to {@code limit} visible messages. Each delivered message gets a fresh
     * receipt handle and stays invisible for the tier's visibility timeout. A message that
     * was already delivered {@code maxReceiveCount} times, or whose body cannot be decoded,
     * is claimed the same way but returned as expired: the caller records its failed outcome
     * and then dead-letters it with {@link #deadLetter}. If the caller never gets that far the
     * message reappears after the visibility timeout and expires again.
     */
    @Transactional
    public ReceiveBatch receive(TierPolicy policy, int limit) {
        if (limit <= 0) {
            return ReceiveBatch.empty();
        }
        Instant now = Instant.now();
        List<QueueMessageRecord> locked = queueMessageRepository.lockVisibleMessages(
                policy.getTier().queueName(), now, limit);
        if (locked.isEmpty()) {
            return ReceiveBatch.empty();
        }

        List<ReceivedMessage> delivered = new ArrayList<>();
        List<ExpiredMessage> expired = new ArrayList<>();
        for (QueueMessageRecord record : locked) {
            UUID handle = UUID.randomUUID();
            record.setReceiptHandle(handle);
            record.setLastReceivedAt(now);
            record.setVisibleAt(now.plus(policy.getVisibilityTimeout()));
            if (record.getReceiveCount() >= policy.getMaxReceiveCount()) {
                expired.add(expire(record, handle, REASON_MAX_RECEIVES,
                        FailureRecord.of(record.getReceiveCount(), FailureRecord.lastKind(record.getFailureHistory()),
                                "Visibility timeout expired " + record.getReceiveCount() + " times")));
                continue;
            }
            QueueMessage body;
            try {
                body = codec.decode(record.getPayload());
            } catch (PermanentQueueException e) {
                expired.add(expire(record, handle, REASON_MALFORMED,
                        FailureRecord.of(record.getReceiveCount(), FailureKind.MALFORMED, e.getMessage())));
                continue;
            }
            record.setReceiveCount(record.getReceiveCount() + 1);
            delivered.add(new ReceivedMessage(handle, record.getMessageUuid(), policy.getTier(),
                    record.getReceiveCount(), body));
        }
        return new ReceiveBatch(delivered, expired);
    }

    /**
     * Deletes the message if the handle is still current.
     *
     * @return false when the handle is stale (the message was redelivered or already removed)
     */
    @Transactional
    public boolean acknowledge(UUID receiptHandle) {
        return queueMessageRepository.deleteByReceiptHandle(receiptHandle) > 0;
    }

    /**
     * Records a failed delivery and makes the message visible again after {@code delay}.
     * The receipt handle is invalidated.
     */
    @Transactional
    public boolean release(UUID receiptHandle, Duration delay, FailureRecord failure) {
        Optional<QueueMessageRecord> found = queueMessageRepository.findByReceiptHandle(receiptHandle);
        if (found.isEmpty()) {
            return false;
        }
        QueueMessageRecord record = found.get();
        appendFailure(record, failure);
        record.setReceiptHandle(null);
        record.setVisibleAt(Instant.now().plus(delay));
        return true;
    }

    /**
     * Hands back a message that was received but never started. The delivery does not count
     * against the redelivery ceiling and the message is visible again at once.
     */
    @Transactional
    public boolean returnUnstarted(UUID receiptHandle) {
        Optional<QueueMessageRecord> found = queueMessageRepository.findByReceiptHandle(receiptHandle);
        if (found.isEmpty()) {
            return false;
        }
        QueueMessageRecord record = found.get();
        record.setReceiveCount(Math.max(0, record.getReceiveCount() - 1));
        record.setReceiptHandle(null);
        record.setVisibleAt(Instant.now());
        return true;
    }

    /**
     * Moves a received message to its tier's dead-letter queue, removing it from the source queue
     * in the same transaction.
     */
    @Transactional
    public Optional<DeadLetterEntry> deadLetter(UUID receiptHandle, String reason, FailureRecord failure) {
        return queueMessageRepository.findByReceiptHandle(receiptHandle)
                .map(record -> moveToDeadLetter(record, reason, failure));
    }

    @Transactional
    public int purgeBatch(UUID batchId) {
        return queueMessageRepository.deleteByBatchUuid(batchId);
    }

    @Transactional(readOnly = true)
    public long countVisible(QueueTier tier) {
        return queueMessageRepository.countVisible(tier.queueName(), Instant.now());
    }

    private DeadLetterEntry moveToDeadLetter(QueueMessageRecord record, String reason, FailureRecord failure) {
        appendFailure(record, failure);
        QueueTier tier = QueueTier.fromQueueName(record.getQueueName());

        DeadLetterEntry entry = new DeadLetterEntry();
        entry.setDeadLetterQueue(tier.deadLetterQueueName());
        entry.setSourceQueue(record.getQueueName());
        entry.setTier(tier);
        entry.setMessageUuid(record.getMessageUuid());
        entry.setJobUuid(record.getJobUuid());
        entry.setBatchUuid(record.getBatchUuid());
        entry.setDocumentReference(documentReferenceOf(record));
        entry.setPayload(record.getPayload());
        entry.setAttemptCount(record.getReceiveCount());
        entry.setReason(reason);
        entry.setLastError(failure != null ? failure.getMessage() : null);
        entry.setFailureHistory(record.getFailureHistory() != null
                ? new ArrayList<>(record.getFailureHistory())
                : new ArrayList<>());
        entry.setCreatedAt(Instant.now());

        DeadLetterEntry saved = deadLetterEntryRepository.save(entry);
        queueMessageRepository.delete(record);
        logger.warn("Message {} for job {} moved to {} after {} attempt(s): {}",
                record.getMessageUuid(), record.getJobUuid(), tier.deadLetterQueueName(),
                record.getReceiveCount(), reason);
        return saved;
    }

    private ExpiredMessage expire(QueueMessageRecord record, UUID handle, String reason, FailureRecord failure) {
        logger.debug("Message {} for job {} expired on {}: {}", record.getMessageUuid(), record.getJobUuid(),
                record.getQueueName(), reason);
        return new ExpiredMessage(handle, QueueTier.fromQueueName(record.getQueueName()), record.getJobUuid(),
                record.getBatchUuid(), documentReferenceOf(record), record.getReceiveCount(), reason, failure);
    }

    private String documentReferenceOf(QueueMessageRecord record) {
        try {
            return codec.decode(record.getPayload()).getDocumentReference();
        } catch (PermanentQueueException e) {
            logger.debug("Dead-lettered message {} has an undecodable body", record.getMessageUuid());
            return "";
        }
    }

    private void appendFailure(QueueMessageRecord record, FailureRecord failure) {
        if (failure == null) {
            return;
        }
        List<Map<String, Object>> history = record.getFailureHistory() != null
                ? new ArrayList<>(record.getFailureHistory())
                : new ArrayList<>();
        history.add(failure.toMap());
        record.setFailureHistory(history);
    }
}

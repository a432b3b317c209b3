package com.batchinsight.queue;

import com.batchinsight.shared.model.DeadLetterEntry;
import com.batchinsight.shared.model.QueueTier;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Three durable job queues (high, normal, low), each backed by its own dead-letter queue.
 * Delivery is at-least-once: a received message that is not acknowledged within the
 * tier's visibility timeout is delivered again.
 */
public interface PriorityQueueSet {

    /**
     * Places a message on the tier's queue. Returns once the message is durably accepted.
     *
     * @return the queue message id
     * @throws TransientQueueException if the queue is unavailable; the caller should retry
     * @throws PermanentQueueException if the message is oversized or malformed
     */
    UUID enqueue(QueueMessage message, QueueTier priority);

    /**
     * Receives up to {@code maxBatch} messages from one tier, waiting at most
     * {@code waitTimeout} for the first one. Once a message is available the call keeps
     * collecting until {@code maxBatch} is reached or the tier's batching delay elapses.
     *
     * @return received messages, empty on timeout
     */
    List<ReceivedMessage> dequeue(QueueTier tier, int maxBatch, Duration waitTimeout);

    /**
     * Receives from the highest-priority tier that has visible messages, using that tier's
     * batch size. Waits at most {@code waitTimeout}.
     */
    List<ReceivedMessage> dequeueNext(Duration waitTimeout);

    /**
     * Permanently removes a received message.
     *
     * @return false if the handle is stale
     */
    boolean acknowledge(UUID receiptHandle);

    /**
     * Returns an unacknowledged message to its queue, visible again after {@code delay}.
     */
    boolean release(UUID receiptHandle, Duration delay, FailureRecord failure);

    /**
     * Returns a received message that was never started. The delivery does not count toward
     * the tier's maxReceiveCount.
     */
    boolean returnUnstarted(UUID receiptHandle);

    /**
     * Moves a received message to its tier's dead-letter queue.
     */
    Optional<DeadLetterEntry> deadLetter(UUID receiptHandle, String reason, FailureRecord failure);

    /**
     * Removes every outstanding message of a batch.
     *
     * @return number of removed messages
     */
    int purgeBatch(UUID batchId);

    /**
     * Number of currently visible messages on the tier's queue.
     */
    long depth(QueueTier tier);

    TierPolicy policy(QueueTier tier);
}

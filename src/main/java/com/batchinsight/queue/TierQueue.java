package com.batchinsight.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * One priority tier: a long-polling receiver over the shared message table with its own
 * batch size, batching delay, visibility timeout and redelivery ceiling.
 */
public class TierQueue {

    private static final Logger logger = LoggerFactory.getLogger(TierQueue.class);

    private final TierPolicy policy;
    private final QueueMessageStore store;
    private final Duration pollInterval;
    private final Consumer<List<ExpiredMessage>> expiryListener;

    public TierQueue(TierPolicy policy, QueueMessageStore store, Duration pollInterval,
                     Consumer<List<ExpiredMessage>> expiryListener) {
        this.policy = policy;
        this.store = store;
        this.pollInterval = pollInterval;
        this.expiryListener = expiryListener;
    }

    public TierPolicy getPolicy() {
        return policy;
    }

    /**
     * Single non-blocking receive round. Expired messages go to the expiry listener before
     * the delivered ones are returned.
     */
    public List<ReceivedMessage> poll(int maxBatch) {
        ReceiveBatch batch = store.receive(policy, maxBatch);
        if (!batch.getExpired().isEmpty()) {
            expiryListener.accept(batch.getExpired());
        }
        return batch.getDelivered();
    }

    /**
     * Long-polls for messages. Returns as soon as {@code maxBatch} messages are collected,
     * when the batching delay has elapsed since the first message arrived, or empty after
     * {@code waitTimeout}.
     */
    public List<ReceivedMessage> receive(int maxBatch, Duration waitTimeout) {
        if (maxBatch <= 0) {
            return List.of();
        }
        Instant waitDeadline = Instant.now().plus(waitTimeout);
        Instant windowEnd = null;
        List<ReceivedMessage> collected = new ArrayList<>();

        while (true) {
            collected.addAll(poll(maxBatch - collected.size()));
            if (collected.size() >= maxBatch) {
                return collected;
            }

            Instant now = Instant.now();
            Instant until;
            if (collected.isEmpty()) {
                if (!now.isBefore(waitDeadline)) {
                    return collected;
                }
                until = waitDeadline;
            } else {
                if (windowEnd == null) {
                    windowEnd = now.plus(policy.getBatchingDelay());
                }
                if (!now.isBefore(windowEnd)) {
                    return collected;
                }
                until = windowEnd;
            }

            if (!sleep(min(pollInterval, Duration.between(now, until)))) {
                return collected;
            }
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private boolean sleep(Duration duration) {
        try {
            Thread.sleep(Math.max(1L, duration.toMillis()));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Receive on {} interrupted", policy.getTier().queueName());
            return false;
        }
    }
}

package com.batchinsight.queue;

import java.util.List;

/**
 * Result of one receive round trip: the deliverable messages and the ones the queue
 * withheld for dead-lettering instead of redelivering.
 */
public final class ReceiveBatch {

    private static final ReceiveBatch EMPTY = new ReceiveBatch(List.of(), List.of());

    private final List<ReceivedMessage> delivered;
    private final List<ExpiredMessage> expired;

    public ReceiveBatch(List<ReceivedMessage> delivered, List<ExpiredMessage> expired) {
        this.delivered = List.copyOf(delivered);
        this.expired = List.copyOf(expired);
    }

    public static ReceiveBatch empty() {
        return EMPTY;
    }

    public List<ReceivedMessage> getDelivered() {
        return delivered;
    }

    public List<ExpiredMessage> getExpired() {
        return expired;
    }
}

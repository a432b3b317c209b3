package com.batchinsight.queue;

import com.batchinsight.shared.model.QueueTier;

import java.util.UUID;

/**
 * A message handed to a consumer. The receipt handle is valid until the message
 * is acknowledged, released, dead-lettered or received again by someone else.
 */
public class ReceivedMessage {

    private final UUID receiptHandle;
    private final UUID messageId;
    private final QueueTier tier;
    private final int receiveCount;
    private final QueueMessage body;

    public ReceivedMessage(UUID receiptHandle, UUID messageId, QueueTier tier, int receiveCount, QueueMessage body) {
        this.receiptHandle = receiptHandle;
        this.messageId = messageId;
        this.tier = tier;
        this.receiveCount = receiveCount;
        this.body = body;
    }

    public UUID getReceiptHandle() {
        return receiptHandle;
    }

    public UUID getMessageId() {
        return messageId;
    }

    public QueueTier getTier() {
        return tier;
    }

    /**
     * Number of times this message has been delivered, including this delivery.
     * This is the attempt number of the job.
     */
    public int getReceiveCount() {
        return receiveCount;
    }

    public QueueMessage getBody() {
        return body;
    }
}

package com.batchinsight.queue;

/**
 * The message can never be accepted (oversized or malformed). Retrying is pointless.
 */
public class PermanentQueueException extends QueueException {

    public PermanentQueueException(String message) {
        super(message);
    }

    public PermanentQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}

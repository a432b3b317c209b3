package com.batchinsight.queue;

/**
 * The queue could not accept or deliver a message right now; the caller should retry.
 */
public class TransientQueueException extends QueueException {

    public TransientQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}

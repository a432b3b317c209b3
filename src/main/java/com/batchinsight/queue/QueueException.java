package com.batchinsight.queue;

/**
 * Base class for queue failures.
 */
public abstract class QueueException extends RuntimeException {

    protected QueueException(String message) {
        super(message);
    }

    protected QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}

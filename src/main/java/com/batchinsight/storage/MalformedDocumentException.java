package com.batchinsight.storage;

/**
 * The referenced document can never be analyzed. Jobs failing with it are not retried.
 */
public class MalformedDocumentException extends RuntimeException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.batchinsight.shared.exception;

public class DeadLetterNotFoundException extends RuntimeException {

    public DeadLetterNotFoundException(Long id) {
        super("Dead-letter entry not found: " + id);
    }
}

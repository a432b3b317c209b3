package com.batchinsight.processing;

import com.batchinsight.queue.TierPolicy;
import com.batchinsight.shared.model.FailureKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Retry ceiling, backoff and cancellation rules shared by the worker pool and the queues.
 * Retryable failures are released for redelivery with exponential backoff until the tier's
 * maxReceiveCount is reached; terminal failures are dead-lettered on the first attempt.
 */
@Component
public class RetryPolicy {

    public static final String REASON_TERMINAL = "TERMINAL_FAILURE";
    public static final String REASON_EXHAUSTED = "MAX_ATTEMPTS_EXCEEDED";

    private final Duration baseDelay;
    private final Duration maxDelay;

    public RetryPolicy(@Value("${app.retry.base-delay:2s}") Duration baseDelay,
                       @Value("${app.retry.max-delay:5m}") Duration maxDelay) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    /**
     * @param attempt         attempt number that just failed, starting at 1
     * @param kind            failure class of the attempt
     * @param batchActive     false once the batch was cancelled, timed out or otherwise finished
     */
    public RetryDecision decide(TierPolicy tier, int attempt, FailureKind kind, boolean batchActive) {
        if (!batchActive) {
            return RetryDecision.abandon("batch no longer running");
        }
        if (!kind.isRetryable()) {
            return RetryDecision.deadLetter(REASON_TERMINAL);
        }
        if (attempt >= tier.getMaxReceiveCount()) {
            return RetryDecision.deadLetter(REASON_EXHAUSTED);
        }
        return RetryDecision.retry(backoff(attempt, tier.getVisibilityTimeout()));
    }

    /**
     * base * 2^(attempt-1), capped by the configured maximum and by the visibility timeout.
     */
    public Duration backoff(int attempt, Duration visibilityTimeout) {
        int exponent = Math.max(0, Math.min(attempt - 1, 20));
        Duration delay = baseDelay.multipliedBy(1L << exponent);
        if (delay.compareTo(maxDelay) > 0) {
            delay = maxDelay;
        }
        if (delay.compareTo(visibilityTimeout) > 0) {
            delay = visibilityTimeout;
        }
        return delay;
    }
}

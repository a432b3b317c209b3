package com.batchinsight.processing;

import java.time.Duration;

/**
 * What to do with a message whose attempt failed.
 */
public final class RetryDecision {

    public enum Action {
        /** Release the message for redelivery after {@link #getDelay()}. */
        RETRY,
        /** Move the message to its tier's dead-letter queue and fail the job. */
        DEAD_LETTER,
        /** The batch is gone or terminal; drop the message without recording anything. */
        ABANDON
    }

    private final Action action;
    private final Duration delay;
    private final String reason;

    private RetryDecision(Action action, Duration delay, String reason) {
        this.action = action;
        this.delay = delay;
        this.reason = reason;
    }

    public static RetryDecision retry(Duration delay) {
        return new RetryDecision(Action.RETRY, delay, null);
    }

    public static RetryDecision deadLetter(String reason) {
        return new RetryDecision(Action.DEAD_LETTER, Duration.ZERO, reason);
    }

    public static RetryDecision abandon(String reason) {
        return new RetryDecision(Action.ABANDON, Duration.ZERO, reason);
    }

    public Action getAction() {
        return action;
    }

    public Duration getDelay() {
        return delay;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return action == Action.RETRY ? "RETRY after " + delay : action + " (" + reason + ")";
    }
}

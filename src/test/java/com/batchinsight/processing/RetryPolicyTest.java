package com.batchinsight.processing;

import com.batchinsight.queue.TierPolicy;
import com.batchinsight.shared.model.FailureKind;
import com.batchinsight.shared.model.QueueTier;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(2), Duration.ofMinutes(5));
    private final TierPolicy normal = new TierPolicy(QueueTier.NORMAL, 5, Duration.ofSeconds(5),
            Duration.ofMinutes(15), 3);

    @Test
    void retryableFailure_belowLimit_isRetriedWithBackoff() {
        RetryDecision first = policy.decide(normal, 1, FailureKind.TIMEOUT, true);
        RetryDecision second = policy.decide(normal, 2, FailureKind.TRANSIENT, true);

        assertThat(first.getAction()).isEqualTo(RetryDecision.Action.RETRY);
        assertThat(first.getDelay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(second.getDelay()).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void retryableFailure_atLimit_isDeadLettered() {
        RetryDecision decision = policy.decide(normal, 3, FailureKind.TIMEOUT, true);

        assertThat(decision.getAction()).isEqualTo(RetryDecision.Action.DEAD_LETTER);
        assertThat(decision.getReason()).isEqualTo(RetryPolicy.REASON_EXHAUSTED);
    }

    @Test
    void terminalFailure_isDeadLetteredOnFirstAttempt() {
        RetryDecision rejected = policy.decide(normal, 1, FailureKind.REJECTED, true);
        RetryDecision malformed = policy.decide(normal, 1, FailureKind.MALFORMED, true);

        assertThat(rejected.getAction()).isEqualTo(RetryDecision.Action.DEAD_LETTER);
        assertThat(rejected.getReason()).isEqualTo(RetryPolicy.REASON_TERMINAL);
        assertThat(malformed.getAction()).isEqualTo(RetryDecision.Action.DEAD_LETTER);
    }

    @Test
    void inactiveBatch_isAbandoned() {
        assertThat(policy.decide(normal, 1, FailureKind.TRANSIENT, false).getAction())
                .isEqualTo(RetryDecision.Action.ABANDON);
    }

    @Test
    void backoff_isCappedByMaxDelayAndVisibility() {
        assertThat(policy.backoff(20, Duration.ofHours(1))).isEqualTo(Duration.ofMinutes(5));
        assertThat(policy.backoff(20, Duration.ofSeconds(30))).isEqualTo(Duration.ofSeconds(30));
    }
}

package com.batchinsight.queue;

import com.batchinsight.shared.model.QueueTier;

import java.time.Duration;
import java.util.Objects;

/**
 * Delivery parameters of one tier queue.
 */
public final class TierPolicy {

    private final QueueTier tier;
    private final int batchSize;
    private final Duration batchingDelay;
    private final Duration visibilityTimeout;
    private final int maxReceiveCount;

    public TierPolicy(QueueTier tier, int batchSize, Duration batchingDelay,
                      Duration visibilityTimeout, int maxReceiveCount) {
        this.tier = Objects.requireNonNull(tier, "tier");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1 for tier " + tier);
        }
        if (maxReceiveCount < 1) {
            throw new IllegalArgumentException("maxReceiveCount must be at least 1 for tier " + tier);
        }
        if (batchingDelay.isNegative() || visibilityTimeout.isNegative() || visibilityTimeout.isZero()) {
            throw new IllegalArgumentException("Invalid batching delay or visibility timeout for tier " + tier);
        }
        this.batchSize = batchSize;
        this.batchingDelay = batchingDelay;
        this.visibilityTimeout = visibilityTimeout;
        this.maxReceiveCount = maxReceiveCount;
    }

    public QueueTier getTier() {
        return tier;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Duration getBatchingDelay() {
        return batchingDelay;
    }

    public Duration getVisibilityTimeout() {
        return visibilityTimeout;
    }

    public int getMaxReceiveCount() {
        return maxReceiveCount;
    }

    @Override
    public String toString() {
        return "TierPolicy{" + tier + ", batchSize=" + batchSize + ", batchingDelay=" + batchingDelay
                + ", visibilityTimeout=" + visibilityTimeout + ", maxReceiveCount=" + maxReceiveCount + "}";
    }
}

package com.batchinsight.queue;

import com.batchinsight.shared.model.QueueTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds the "app.queue" properties. Defaults mirror the production tier table.
 */
@ConfigurationProperties(prefix = "app.queue")
public class QueueProperties {

    private Duration pollInterval = Duration.ofMillis(500);
    private Tiers tiers = new Tiers();

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Tiers getTiers() {
        return tiers;
    }

    public void setTiers(Tiers tiers) {
        this.tiers = tiers;
    }

    public TierPolicy policyFor(QueueTier tier) {
        Tier settings;
        if (tier == QueueTier.HIGH) {
            settings = tiers.getHigh();
        } else if (tier == QueueTier.NORMAL) {
            settings = tiers.getNormal();
        } else {
            settings = tiers.getLow();
        }
        return new TierPolicy(tier, settings.getBatchSize(), settings.getBatchingDelay(),
                settings.getVisibilityTimeout(), settings.getMaxReceiveCount());
    }

    public static class Tiers {
        private Tier high = new Tier(1, Duration.ZERO);
        private Tier normal = new Tier(5, Duration.ofSeconds(5));
        private Tier low = new Tier(10, Duration.ofSeconds(10));

        public Tier getHigh() {
            return high;
        }

        public void setHigh(Tier high) {
            this.high = high;
        }

        public Tier getNormal() {
            return normal;
        }

        public void setNormal(Tier normal) {
            this.normal = normal;
        }

        public Tier getLow() {
            return low;
        }

        public void setLow(Tier low) {
            this.low = low;
        }
    }

    public static class Tier {
        private int batchSize;
        private Duration batchingDelay;
        private Duration visibilityTimeout = Duration.ofMinutes(15);
        private int maxReceiveCount = 3;

        public Tier() {
            this(1, Duration.ZERO);
        }

        public Tier(int batchSize, Duration batchingDelay) {
            this.batchSize = batchSize;
            this.batchingDelay = batchingDelay;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getBatchingDelay() {
            return batchingDelay;
        }

        public void setBatchingDelay(Duration batchingDelay) {
            this.batchingDelay = batchingDelay;
        }

        public Duration getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public int getMaxReceiveCount() {
            return maxReceiveCount;
        }

        public void setMaxReceiveCount(int maxReceiveCount) {
            this.maxReceiveCount = maxReceiveCount;
        }
    }
}

package com.batchinsight.shared.model;

import java.util.Locale;

/**
 * Priority tiers. Each tier owns one queue and one dead-letter queue.
 * Declaration order is dequeue preference order.
 */
public enum QueueTier {
    HIGH,
    NORMAL,
    LOW;

    public String queueName() {
        return "batch-" + name().toLowerCase(Locale.ROOT) + "-priority";
    }

    public String deadLetterQueueName() {
        return queueName() + "-dlq";
    }

    /**
     * Resolves the tier owning a queue or dead-letter queue name.
     *
     * @throws IllegalArgumentException if no tier owns the name
     */
    public static QueueTier fromQueueName(String queueName) {
        for (QueueTier tier : values()) {
            if (tier.queueName().equals(queueName) || tier.deadLetterQueueName().equals(queueName)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown queue: " + queueName);
    }

    /**
     * Parses a priority value from a request; null or blank means NORMAL.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static QueueTier fromPriority(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        return QueueTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.batchinsight.messaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Writes completion events to the log. Registered when pubsub.enabled is false or missing.
 */
@Service
@ConditionalOnProperty(prefix = "pubsub", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LoggingBatchNotificationPublisher implements BatchNotificationPublisher {

    private static final Logger logger = LoggerFactory.getLogger(LoggingBatchNotificationPublisher.class);

    @Override
    public void publish(BatchNotification notification) {
        logger.info("Batch {} finished with status {}: {}", notification.getBatchId(), notification.getStatus(),
                notification.getSummary());
    }
}

package com.batchinsight.messaging;

/**
 * Publishes batch completion events.
 * Implementations may publish to Pub/Sub or just log for local development.
 */
public interface BatchNotificationPublisher {

    /**
     * Publishes a completion event. Returns only after the event was accepted.
     *
     * @throws NotificationException if the event could not be published; the caller retries later
     */
    void publish(BatchNotification notification);
}

package com.batchinsight.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.core.ApiFuture;
import com.google.cloud.pubsub.v1.Publisher;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.TopicName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes batch completion events to a Google Cloud Pub/Sub topic.
 * Supports both real Pub/Sub and the local emulator (via PUBSUB_EMULATOR_HOST).
 * Only loads when pubsub.enabled=true.
 */
@Service
@ConditionalOnProperty(prefix = "pubsub", name = "enabled", havingValue = "true")
public class PubSubBatchNotificationPublisher implements BatchNotificationPublisher {

    private static final Logger logger = LoggerFactory.getLogger(PubSubBatchNotificationPublisher.class);

    private final String projectId;
    private final String topicName;
    private final ObjectMapper objectMapper;
    private Publisher publisher;

    public PubSubBatchNotificationPublisher(
            @Value("${pubsub.project-id:#{T(java.lang.System).getenv('GOOGLE_CLOUD_PROJECT')}}") String projectId,
            @Value("${pubsub.topic-name:batch-completed}") String topicName,
            ObjectMapper objectMapper) {
        this.projectId = projectId != null && !projectId.isEmpty() ? projectId : "local-project";
        this.topicName = topicName;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void initialize() {
        TopicName topic = TopicName.of(projectId, topicName);
        try {
            this.publisher = Publisher.newBuilder(topic).build();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize Pub/Sub publisher for " + topic, e);
        }
        String emulatorHost = System.getenv("PUBSUB_EMULATOR_HOST");
        if (emulatorHost != null && !emulatorHost.isEmpty()) {
            logger.info("Using Pub/Sub emulator at: {}", emulatorHost);
        }
        logger.info("Pub/Sub notification publisher initialized for topic: projects/{}/topics/{}", projectId, topicName);
    }

    @Override
    public void publish(BatchNotification notification) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("batch_id", notification.getBatchId().toString());
        payload.put("owner", notification.getOwner());
        payload.put("status", notification.getStatus());
        payload.put("summary", notification.getSummary());
        payload.put("succeeded", notification.getSucceeded());
        payload.put("failed", notification.getFailed());
        payload.put("completed_at", notification.getCompletedAt() != null
                ? notification.getCompletedAt().toString() : null);

        PubsubMessage message;
        try {
            message = PubsubMessage.newBuilder()
                    .setData(ByteString.copyFromUtf8(objectMapper.writeValueAsString(payload)))
                    .putAttributes("batch_id", notification.getBatchId().toString())
                    .putAttributes("status", notification.getStatus())
                    .build();
        } catch (JsonProcessingException e) {
            throw new NotificationException("Failed to serialize notification for batch "
                    + notification.getBatchId(), e);
        }

        try {
            ApiFuture<String> future = publisher.publish(message);
            String messageId = future.get(10, TimeUnit.SECONDS);
            logger.info("Published completion of batch {} to Pub/Sub. Message ID: {}",
                    notification.getBatchId(), messageId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while publishing to Pub/Sub", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new NotificationException("Failed to publish completion of batch "
                    + notification.getBatchId() + " to Pub/Sub", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (publisher == null) {
            return;
        }
        try {
            publisher.shutdown();
            publisher.awaitTermination(5, TimeUnit.SECONDS);
            logger.info("Pub/Sub publisher shut down successfully");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while shutting down Pub/Sub publisher");
        }
    }
}

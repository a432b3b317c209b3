package com.batchinsight.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * JSON codec for queue message bodies. Rejects bodies the queue can never carry.
 */
@Component
public class QueueMessageCodec {

    public static final int MAX_PAYLOAD_BYTES = 256 * 1024;
    public static final int MAX_DOCUMENT_REFERENCE_LENGTH = 1024;

    private final ObjectMapper objectMapper;

    public QueueMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(QueueMessage message) {
        validate(message);
        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new PermanentQueueException("Message body cannot be serialized: " + e.getOriginalMessage(), e);
        }
        int size = json.getBytes(StandardCharsets.UTF_8).length;
        if (size > MAX_PAYLOAD_BYTES) {
            throw new PermanentQueueException("Message payload is " + size + " bytes, limit is " + MAX_PAYLOAD_BYTES);
        }
        return json;
    }

    public QueueMessage decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new PermanentQueueException("Empty message payload");
        }
        QueueMessage message;
        try {
            message = objectMapper.readValue(payload, QueueMessage.class);
        } catch (JsonProcessingException e) {
            throw new PermanentQueueException("Message payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        validate(message);
        return message;
    }

    private void validate(QueueMessage message) {
        if (message == null) {
            throw new PermanentQueueException("Message is required");
        }
        if (message.getJobId() == null || message.getBatchId() == null) {
            throw new PermanentQueueException("Message must carry jobId and batchId");
        }
        String reference = message.getDocumentReference();
        if (reference == null || reference.isBlank()) {
            throw new PermanentQueueException("Message for job " + message.getJobId() + " has no document reference");
        }
        if (reference.length() > MAX_DOCUMENT_REFERENCE_LENGTH) {
            throw new PermanentQueueException("Document reference exceeds " + MAX_DOCUMENT_REFERENCE_LENGTH + " characters");
        }
        if (message.getPriority() == null) {
            throw new PermanentQueueException("Message for job " + message.getJobId() + " has no priority");
        }
    }
}

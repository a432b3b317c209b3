package com.batchinsight.orchestration;

import com.batchinsight.queue.QueueMessageCodec;
import com.batchinsight.shared.dto.SubmitBatchRequest;
import com.batchinsight.shared.model.QueueTier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a submission before any job exists. Returns field errors keyed by field path;
 * an empty map means the request is valid.
 */
@Component
public class BatchRequestValidator {

    static final int MAX_OWNER_LENGTH = 255;
    static final int MAX_OPTIONS_BYTES = 64 * 1024;

    private final ObjectMapper objectMapper;
    private final int maxDocuments;

    public BatchRequestValidator(ObjectMapper objectMapper,
                                 @Value("${app.batch.max-documents:10000}") int maxDocuments) {
        this.objectMapper = objectMapper;
        this.maxDocuments = maxDocuments;
    }

    public Map<String, String> validate(SubmitBatchRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (request.getOwner() != null && request.getOwner().length() > MAX_OWNER_LENGTH) {
            errors.put("owner", "owner must be at most " + MAX_OWNER_LENGTH + " characters");
        }

        try {
            QueueTier.fromPriority(request.getPriority());
        } catch (IllegalArgumentException e) {
            errors.put("priority", "priority must be one of high, normal, low");
        }

        List<String> documents = request.getDocuments();
        if (documents == null) {
            errors.put("documents", "documents is required");
        } else {
            if (documents.size() > maxDocuments) {
                errors.put("documents", "at most " + maxDocuments + " documents are allowed per batch");
            }
            for (int i = 0; i < documents.size(); i++) {
                String reference = documents.get(i);
                if (reference == null || reference.isBlank()) {
                    errors.put("documents[" + i + "]", "document reference must not be blank");
                } else if (reference.length() > QueueMessageCodec.MAX_DOCUMENT_REFERENCE_LENGTH) {
                    errors.put("documents[" + i + "]", "document reference must be at most "
                            + QueueMessageCodec.MAX_DOCUMENT_REFERENCE_LENGTH + " characters");
                }
            }
        }

        Map<String, Object> options = request.getOptions();
        if (options != null) {
            for (String key : options.keySet()) {
                if (key == null || key.isBlank()) {
                    errors.put("options", "option names must not be blank");
                    break;
                }
            }
            if (!errors.containsKey("options")) {
                try {
                    int size = objectMapper.writeValueAsString(options).getBytes(StandardCharsets.UTF_8).length;
                    if (size > MAX_OPTIONS_BYTES) {
                        errors.put("options", "options must serialize to at most " + MAX_OPTIONS_BYTES + " bytes");
                    }
                } catch (JsonProcessingException e) {
                    errors.put("options", "options are not serializable: " + e.getOriginalMessage());
                }
            }
        }
        return errors;
    }
}

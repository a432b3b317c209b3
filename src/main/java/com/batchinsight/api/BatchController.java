package com.batchinsight.api;

import com.batchinsight.orchestration.BatchOrchestrator;
import com.batchinsight.orchestration.BatchQueryService;
import com.batchinsight.shared.dto.BatchStatusResponse;
import com.batchinsight.shared.dto.SubmitBatchRequest;
import com.batchinsight.shared.dto.SubmitBatchResponse;
import com.batchinsight.shared.model.Batch;
import com.batchinsight.util.MdcKeys;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/batches")
@Tag(name = "Batches", description = "Batch submission, status and cancellation endpoints")
public class BatchController {

    private static final Logger logger = LoggerFactory.getLogger(BatchController.class);

    private final BatchOrchestrator orchestrator;
    private final BatchQueryService queryService;

    public BatchController(BatchOrchestrator orchestrator, BatchQueryService queryService) {
        this.orchestrator = orchestrator;
        this.queryService = queryService;
    }

    @PostMapping
    @Operation(summary = "Submit a batch of documents for analysis",
               description = "Stores the batch and returns its id immediately; jobs are queued asynchronously")
    public ResponseEntity<SubmitBatchResponse> submit(@Valid @RequestBody SubmitBatchRequest request) {
        Batch batch = orchestrator.submit(request);
        MDC.put(MdcKeys.BATCH_ID, batch.getBatchUuid().toString());
        try {
            logger.info("Batch {} submitted with {} document(s)", batch.getBatchUuid(), batch.getDocuments().size());
        } finally {
            MDC.remove(MdcKeys.BATCH_ID);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SubmitBatchResponse(batch.getBatchUuid(),
                batch.getStatus().name(), "/api/batches/" + batch.getBatchUuid()));
    }

    @GetMapping("/{batchId}")
    @Operation(summary = "Get batch status",
               description = "Progress counters while running; the aggregate result once the batch is terminal")
    public ResponseEntity<BatchStatusResponse> getStatus(
            @Parameter(description = "Batch id") @PathVariable UUID batchId) {
        return ResponseEntity.ok(queryService.getStatus(batchId));
    }

    @PostMapping("/{batchId}/cancel")
    @Operation(summary = "Cancel a batch", description = "Fails a non-terminal batch and discards its queued jobs")
    public ResponseEntity<Map<String, Object>> cancel(@Parameter(description = "Batch id") @PathVariable UUID batchId) {
        Batch batch = orchestrator.cancel(batchId);
        Map<String, Object> response = new HashMap<>();
        response.put("batchId", batch.getBatchUuid());
        response.put("status", batch.getStatus().name());
        response.put("message", "Batch cancelled");
        return ResponseEntity.ok(response);
    }
}

package com.batchinsight.api;

import com.batchinsight.orchestration.DeadLetterService;
import com.batchinsight.shared.dto.DeadLetterResponse;
import com.batchinsight.shared.dto.SubmitBatchResponse;
import com.batchinsight.shared.model.Batch;
import com.batchinsight.shared.model.QueueTier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/dead-letters")
@Tag(name = "Dead letters", description = "Inspection and replay of dead-lettered jobs")
public class DeadLetterController {

    private final DeadLetterService deadLetterService;

    public DeadLetterController(DeadLetterService deadLetterService) {
        this.deadLetterService = deadLetterService;
    }

    @GetMapping
    @Operation(summary = "List dead-lettered jobs", description = "Newest first, optionally filtered by tier")
    public ResponseEntity<List<DeadLetterResponse>> list(
            @Parameter(description = "high, normal or low") @RequestParam(required = false) String tier) {
        QueueTier filter = tier != null && !tier.isBlank() ? QueueTier.fromPriority(tier) : null;
        return ResponseEntity.ok(deadLetterService.list(filter));
    }

    @PostMapping("/{id}/replay")
    @Operation(summary = "Replay a dead-lettered job", description = "Submits the document again as a new batch")
    public ResponseEntity<SubmitBatchResponse> replay(@PathVariable Long id) {
        Batch batch = deadLetterService.replay(id);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SubmitBatchResponse(batch.getBatchUuid(),
                batch.getStatus().name(), "/api/batches/" + batch.getBatchUuid()));
    }
}

package com.batchinsight.orchestration;

import com.batchinsight.shared.dto.AggregateResult;
import com.batchinsight.shared.dto.BatchStatusResponse;
import com.batchinsight.shared.exception.BatchNotFoundException;
import com.batchinsight.shared.model.Batch;
import com.batchinsight.shared.repository.BatchRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.UUID;

/**
 * Read side of batches: status with progress counters, plus the aggregate once terminal.
 */
@Service
public class BatchQueryService {

    private final BatchRepository batchRepository;
    private final Aggregator aggregator;

    public BatchQueryService(BatchRepository batchRepository, Aggregator aggregator) {
        this.batchRepository = batchRepository;
        this.aggregator = aggregator;
    }

    @Transactional(readOnly = true)
    public BatchStatusResponse getStatus(UUID batchId) {
        Batch batch = batchRepository.findByBatchUuid(batchId)
                .orElseThrow(() -> new BatchNotFoundException(batchId));

        BatchStatusResponse response = new BatchStatusResponse();
        response.setBatchId(batch.getBatchUuid());
        response.setOwner(batch.getOwner());
        response.setStatus(batch.getStatus().name());
        response.setPriority(batch.getPriority().name().toLowerCase(Locale.ROOT));
        response.setProgress(new BatchStatusResponse.ProgressInfo(batch.getExpectedJobCount(),
                batch.getSucceededCount(), batch.getFailedCount()));
        response.setErrorMessage(batch.getErrorMessage());
        response.setCreatedAt(batch.getCreatedAt());
        response.setDeadlineAt(batch.getDeadlineAt());
        response.setCompletedAt(batch.getCompletedAt());
        if (batch.getStatus().isTerminal()) {
            response.setResult(aggregator.toResult(batch));
        }
        return response;
    }

    /**
     * Aggregate result of a batch in its current state.
     */
    @Transactional(readOnly = true)
    public AggregateResult getResult(UUID batchId) {
        return aggregator.snapshot(batchId);
    }
}

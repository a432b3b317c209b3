package com.batchinsight.orchestration;

import com.batchinsight.shared.model.BatchStatus;
import org.springframework.stereotype.Component;

/**
 * Derives the terminal status of a batch from its tally.
 */
@Component
public class DecisionPolicy {

    /**
     * TIMED_OUT when the deadline forced aggregation; otherwise SUCCEEDED with no failures
     * (including an empty batch), FAILED when every job failed and PARTIALLY_FAILED in between.
     */
    public BatchStatus decide(int total, int failed, boolean deadlineExceeded) {
        if (deadlineExceeded) {
            return BatchStatus.TIMED_OUT;
        }
        if (failed <= 0) {
            return BatchStatus.SUCCEEDED;
        }
        if (failed >= total) {
            return BatchStatus.FAILED;
        }
        return BatchStatus.PARTIALLY_FAILED;
    }

    public String summarize(BatchStatus status, int total, int succeeded, int failed) {
        if (total == 0) {
            return "Empty batch: no documents to analyze";
        }
        String summary = succeeded + " of " + total + " document(s) succeeded, " + failed + " failed";
        if (status == BatchStatus.TIMED_OUT) {
            summary += " (batch deadline exceeded)";
        }
        return summary;
    }
}

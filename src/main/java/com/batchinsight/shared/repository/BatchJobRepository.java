package com.batchinsight.shared.repository;

import com.batchinsight.shared.model.BatchJob;
import com.batchinsight.shared.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for BatchJob entities.
 */
@Repository
public interface BatchJobRepository extends JpaRepository<BatchJob, Long> {

    Optional<BatchJob> findByJobUuid(UUID jobUuid);

    List<BatchJob> findByBatchUuidOrderByOrdinalAsc(UUID batchUuid);

    List<BatchJob> findByBatchUuidAndStatusIn(UUID batchUuid, Collection<JobStatus> statuses);

    long countByBatchUuid(UUID batchUuid);

    /**
     * Marks a job as picked up by a worker. The attempt count only ever grows.
     * Terminal jobs are left untouched.
     *
     * @return number of rows updated (0 if the job is already terminal)
     */
    @Modifying
    @Query(value = "UPDATE batch_jobs SET status = 'IN_FLIGHT', " +
            "attempt_count = GREATEST(attempt_count, :attempt), last_dequeued_at = :now " +
            "WHERE job_uuid = :jobUuid AND status NOT IN ('SUCCEEDED', 'FAILED_TERMINAL')",
            nativeQuery = true)
    int markInFlight(@Param("jobUuid") UUID jobUuid, @Param("attempt") int attempt, @Param("now") Instant now);

    /**
     * Records a retryable failure; the job waits for redelivery.
     */
    @Modifying
    @Query(value = "UPDATE batch_jobs SET status = 'FAILED_RETRYABLE', last_error = :error " +
            "WHERE job_uuid = :jobUuid AND status NOT IN ('SUCCEEDED', 'FAILED_TERMINAL')",
            nativeQuery = true)
    int markRetryable(@Param("jobUuid") UUID jobUuid, @Param("error") String error);
}

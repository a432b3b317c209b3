package com.batchinsight.shared.repository;

import com.batchinsight.shared.model.JobOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for JobOutcome entities.
 */
@Repository
public interface JobOutcomeRepository extends JpaRepository<JobOutcome, Long> {

    boolean existsByJobUuid(UUID jobUuid);

    List<JobOutcome> findByBatchUuidOrderByOrdinalAsc(UUID batchUuid);

    long countByBatchUuid(UUID batchUuid);
}

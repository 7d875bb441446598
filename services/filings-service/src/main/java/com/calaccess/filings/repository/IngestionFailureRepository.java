package com.calaccess.filings.repository;

import com.calaccess.filings.domain.IngestionFailureEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IngestionFailureRepository extends JpaRepository<IngestionFailureEntity, UUID> {

    List<IngestionFailureEntity> findTop20ByRunIdOrderByCreatedAtDesc(UUID runId);

    long countByRunId(UUID runId);
}

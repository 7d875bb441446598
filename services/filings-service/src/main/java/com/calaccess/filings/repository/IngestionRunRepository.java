package com.calaccess.filings.repository;

import com.calaccess.filings.domain.IngestionRunEntity;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IngestionRunRepository extends JpaRepository<IngestionRunEntity, UUID> {
}

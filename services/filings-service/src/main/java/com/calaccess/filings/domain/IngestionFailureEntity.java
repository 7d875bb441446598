package com.calaccess.filings.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "ingestion_failures", indexes = @Index(name = "ix_ingestion_failures_run", columnList = "run_id"))
public class IngestionFailureEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "filing_id")
    private Integer filingId;

    @Column(name = "amend_id")
    private Integer amendId;

    @Column(name = "failure_code", nullable = false)
    private String failureCode;

    @Column(name = "failure_reason", nullable = false, length = 400)
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static IngestionFailureEntity of(UUID runId, Integer filingId, Integer amendId, String code, String reason) {
        IngestionFailureEntity entity = new IngestionFailureEntity();
        entity.id = UUID.randomUUID();
        entity.runId = runId;
        entity.filingId = filingId;
        entity.amendId = amendId;
        entity.failureCode = code;
        entity.failureReason = reason;
        entity.createdAt = Instant.now();
        return entity;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRunId() {
        return runId;
    }

    public Integer getFilingId() {
        return filingId;
    }

    public Integer getAmendId() {
        return amendId;
    }

    public String getFailureCode() {
        return failureCode;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}

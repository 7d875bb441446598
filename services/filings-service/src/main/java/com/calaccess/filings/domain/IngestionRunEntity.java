package com.calaccess.filings.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "ingestion_runs")
public class IngestionRunEntity {

    @Id
    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    // api, or the inbox file name
    @Column(name = "source", nullable = false)
    private String source;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private RunStatus status;

    @Column(name = "received_count", nullable = false)
    private int receivedCount;

    @Column(name = "inserted_count", nullable = false)
    private int insertedCount;

    @Column(name = "updated_count", nullable = false)
    private int updatedCount;

    @Column(name = "skipped_count", nullable = false)
    private int skippedCount;

    @Column(name = "failed_count", nullable = false)
    private int failedCount;

    @Column(name = "error_summary", length = 400)
    private String errorSummary;

    public static IngestionRunEntity startNew(String source) {
        IngestionRunEntity run = new IngestionRunEntity();
        run.runId = UUID.randomUUID();
        run.source = source;
        run.startedAt = Instant.now();
        run.status = RunStatus.RUNNING;
        return run;
    }

    public void incrementReceived() {
        this.receivedCount++;
    }

    public void record(UpsertResult result) {
        switch (result) {
            case INSERTED -> this.insertedCount++;
            case UPDATED -> this.updatedCount++;
            case SKIPPED -> this.skippedCount++;
        }
    }

    public void incrementFailed() {
        this.failedCount++;
    }

    public void complete() {
        this.completedAt = Instant.now();
        if (failedCount == 0) {
            this.status = RunStatus.SUCCEEDED;
        } else {
            // every submission failed
            this.status = failedCount == receivedCount ? RunStatus.FAILED : RunStatus.PARTIAL_SUCCESS;
        }
    }

    public void fail(String errorSummary) {
        this.completedAt = Instant.now();
        this.status = RunStatus.FAILED;
        this.errorSummary = errorSummary;
    }

    public UUID getRunId() {
        return runId;
    }

    public String getSource() {
        return source;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public RunStatus getStatus() {
        return status;
    }

    public int getReceivedCount() {
        return receivedCount;
    }

    public int getInsertedCount() {
        return insertedCount;
    }

    public int getUpdatedCount() {
        return updatedCount;
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public String getErrorSummary() {
        return errorSummary;
    }
}

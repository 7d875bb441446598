package com.calaccess.filings.controller;

import com.calaccess.filings.domain.RunStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record IngestionRunResponse(
    UUID runId,
    String source,
    RunStatus status,
    Instant startedAt,
    Instant completedAt,
    int receivedCount,
    int insertedCount,
    int updatedCount,
    int skippedCount,
    int failedCount,
    String errorSummary,
    List<FailureItem> recentFailures
) {
    public record FailureItem(Integer filingId, Integer amendId, String code, String reason, Instant createdAt) {
    }
}

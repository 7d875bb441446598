package com.calaccess.filings.controller;

import com.calaccess.filings.domain.IngestionFailureEntity;
import com.calaccess.filings.domain.IngestionRunEntity;
import com.calaccess.filings.service.IngestionJobService;
import com.calaccess.filings.service.RecordNotFoundException;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/ingestion")
public class IngestionController {

    private static final String DEFAULT_SOURCE = "api";

    private final IngestionJobService ingestionJobService;

    public IngestionController(IngestionJobService ingestionJobService) {
        this.ingestionJobService = ingestionJobService;
    }

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(@Valid @RequestBody IngestionRunRequest request) {
        String source = request.source() == null || request.source().isBlank() ? DEFAULT_SOURCE : request.source();
        UUID runId = ingestionJobService.runIngestion(source, request.submissions());
        return ResponseEntity.accepted().body(Map.of("runId", runId));
    }

    @GetMapping("/runs/{runId}")
    public IngestionRunResponse getRun(@PathVariable UUID runId) {
        IngestionRunEntity run = ingestionJobService.getRun(runId)
            .orElseThrow(() -> new RecordNotFoundException("Run not found: " + runId));

        List<IngestionRunResponse.FailureItem> failures = ingestionJobService.getRunFailures(runId)
            .stream()
            .map(this::toFailureItem)
            .toList();

        return new IngestionRunResponse(
            run.getRunId(),
            run.getSource(),
            run.getStatus(),
            run.getStartedAt(),
            run.getCompletedAt(),
            run.getReceivedCount(),
            run.getInsertedCount(),
            run.getUpdatedCount(),
            run.getSkippedCount(),
            run.getFailedCount(),
            run.getErrorSummary(),
            failures
        );
    }

    private IngestionRunResponse.FailureItem toFailureItem(IngestionFailureEntity entity) {
        return new IngestionRunResponse.FailureItem(
            entity.getFilingId(),
            entity.getAmendId(),
            entity.getFailureCode(),
            entity.getFailureReason(),
            entity.getCreatedAt()
        );
    }
}

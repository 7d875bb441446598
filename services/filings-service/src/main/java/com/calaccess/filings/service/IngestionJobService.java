package com.calaccess.filings.service;

import com.calaccess.filings.domain.Form460Submission;
import com.calaccess.filings.domain.IngestionFailureEntity;
import com.calaccess.filings.domain.IngestionRunEntity;
import com.calaccess.filings.domain.UpsertResult;
import com.calaccess.filings.repository.IngestionFailureRepository;
import com.calaccess.filings.repository.IngestionRunRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs batches of submissions through {@link Form460FilingService#ingest} and keeps a record of
 * each run.
 *
 * <p>Each submission is ingested in its own transaction, so one bad submission is recorded as a
 * failure and the rest of the batch still goes through.
 */
@Service
public class IngestionJobService {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionJobService.class);

    static final String DUPLICATE_RECORD = "DUPLICATE_RECORD";
    static final String MISSING_FIELD = "MISSING_FIELD";
    static final String INVALID_FIELD = "INVALID_FIELD";
    static final String PROCESSING_ERROR = "PROCESSING_ERROR";

    private final Form460FilingService filingService;
    private final IngestionRunRepository ingestionRunRepository;
    private final IngestionFailureRepository ingestionFailureRepository;

    public IngestionJobService(
        Form460FilingService filingService,
        IngestionRunRepository ingestionRunRepository,
        IngestionFailureRepository ingestionFailureRepository
    ) {
        this.filingService = filingService;
        this.ingestionRunRepository = ingestionRunRepository;
        this.ingestionFailureRepository = ingestionFailureRepository;
    }

    public UUID runIngestion(String source, List<Form460Submission> submissions) {
        IngestionRunEntity run = ingestionRunRepository.save(IngestionRunEntity.startNew(source));
        try {
            for (Form460Submission submission : submissions) {
                run.incrementReceived();
                try {
                    UpsertResult result = filingService.ingest(submission);
                    run.record(result);
                } catch (Exception ex) {
                    run.incrementFailed();
                    Integer filingId = submission == null ? null : submission.filingId();
                    Integer amendId = submission == null ? null : submission.amendId();
                    LOGGER.warn("Run {}: filing {} amendment {} failed: {}", run.getRunId(), filingId, amendId, ex.getMessage());
                    ingestionFailureRepository.save(IngestionFailureEntity.of(
                        run.getRunId(),
                        filingId,
                        amendId,
                        failureCode(ex),
                        truncate(ex.getMessage(), 400)
                    ));
                }
            }

            run.complete();
            ingestionRunRepository.save(run);
            LOGGER.info("Run {} from {} finished {}: {} received, {} inserted, {} updated, {} skipped, {} failed",
                run.getRunId(), source, run.getStatus(), run.getReceivedCount(), run.getInsertedCount(),
                run.getUpdatedCount(), run.getSkippedCount(), run.getFailedCount());
            return run.getRunId();
        } catch (RuntimeException fatal) {
            run.fail(truncate(fatal.getMessage(), 400));
            ingestionRunRepository.save(run);
            throw fatal;
        }
    }

    public Optional<IngestionRunEntity> getRun(UUID runId) {
        return ingestionRunRepository.findById(runId);
    }

    public List<IngestionFailureEntity> getRunFailures(UUID runId) {
        return ingestionFailureRepository.findTop20ByRunIdOrderByCreatedAtDesc(runId);
    }

    static String failureCode(Exception ex) {
        if (ex instanceof DuplicateRecordException) {
            return DUPLICATE_RECORD;
        }
        if (ex instanceof MissingFieldException) {
            return MISSING_FIELD;
        }
        if (ex instanceof IllegalArgumentException) {
            return INVALID_FIELD;
        }
        return PROCESSING_ERROR;
    }

    private String truncate(String text, int max) {
        if (text == null || text.isBlank()) {
            return "unknown";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}

package com.calaccess.filings.batch;

import com.calaccess.filings.client.SubmissionInbox;
import com.calaccess.filings.config.IngestionProperties;
import com.calaccess.filings.domain.Form460Submission;
import com.calaccess.filings.service.IngestionJobService;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Ingests submission batches dropped into the inbox, one run per batch file.
 */
@Component
public class IngestionScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionScheduler.class);

    private final IngestionProperties properties;
    private final IngestionJobService ingestionJobService;
    private final SubmissionInbox submissionInbox;

    public IngestionScheduler(
        IngestionProperties properties,
        IngestionJobService ingestionJobService,
        SubmissionInbox submissionInbox
    ) {
        this.properties = properties;
        this.ingestionJobService = ingestionJobService;
        this.submissionInbox = submissionInbox;
    }

    @Scheduled(fixedDelayString = "${ingestion.scheduler-fixed-delay-ms:300000}")
    public void runScheduledIngestion() {
        if (!properties.isSchedulerEnabled()) {
            return;
        }
        List<Path> batches = submissionInbox.pending();
        if (batches.isEmpty()) {
            return;
        }
        LOGGER.info("Running scheduled ingestion for {} batch files", batches.size());
        for (Path batch : batches) {
            ingestBatch(batch);
        }
    }

    void ingestBatch(Path batch) {
        String source = batch.getFileName().toString();
        List<Form460Submission> submissions;
        try {
            submissions = submissionInbox.read(batch);
        } catch (IllegalStateException ex) {
            LOGGER.error("Skipping unreadable batch {}", source, ex);
            submissionInbox.archive(batch, true);
            return;
        }
        UUID runId;
        try {
            runId = ingestionJobService.runIngestion(source, submissions);
        } catch (RuntimeException ex) {
            LOGGER.error("Ingestion of batch {} failed", source, ex);
            submissionInbox.archive(batch, true);
            return;
        }
        Path archived = submissionInbox.archive(batch, false);
        LOGGER.info("Batch {} ingested as run {}, archived to {}", source, runId, archived);
    }
}

package com.calaccess.filings.batch;

import com.calaccess.filings.client.SubmissionInbox;
import com.calaccess.filings.config.IngestionProperties;
import com.calaccess.filings.domain.Form460Submission;
import com.calaccess.filings.service.IngestionJobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static com.calaccess.filings.Form460Fixtures.summary;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionScheduler Unit Tests")
class IngestionSchedulerTest {

    @Mock
    private IngestionJobService ingestionJobService;

    @Mock
    private SubmissionInbox submissionInbox;

    private IngestionProperties properties;
    private IngestionScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        scheduler = new IngestionScheduler(properties, ingestionJobService, submissionInbox);
    }

    @Test
    @DisplayName("Does nothing while disabled")
    void skipsWhenDisabled() {
        scheduler.runScheduledIngestion();

        verifyNoInteractions(submissionInbox, ingestionJobService);
    }

    @Test
    @DisplayName("Ingests each pending batch and archives it")
    void ingestsPendingBatches() {
        properties.setSchedulerEnabled(true);
        Path batch = Path.of("inbox", "batch-01.json");
        List<Form460Submission> submissions = List.of(Form460Submission.summaryOnly(1001, 0, summary(5000)));
        when(submissionInbox.pending()).thenReturn(List.of(batch));
        when(submissionInbox.read(batch)).thenReturn(submissions);
        when(ingestionJobService.runIngestion("batch-01.json", submissions)).thenReturn(UUID.randomUUID());

        scheduler.runScheduledIngestion();

        verify(submissionInbox).archive(batch, false);
    }

    @Test
    @DisplayName("Unreadable batches are archived as failed without a run")
    void archivesUnreadableBatch() {
        Path batch = Path.of("inbox", "broken.json");
        when(submissionInbox.read(batch)).thenThrow(new IllegalStateException("Failed to read submission batch broken.json"));

        scheduler.ingestBatch(batch);

        verify(submissionInbox).archive(batch, true);
        verify(ingestionJobService, never()).runIngestion(any(), anyList());
    }

    @Test
    @DisplayName("Batches whose run aborts are archived as failed")
    void archivesAbortedRun() {
        Path batch = Path.of("inbox", "batch-02.json");
        when(submissionInbox.read(batch)).thenReturn(List.of());
        when(ingestionJobService.runIngestion("batch-02.json", List.of()))
            .thenThrow(new IllegalStateException("database unavailable"));

        scheduler.ingestBatch(batch);

        verify(submissionInbox).archive(batch, true);
        verify(submissionInbox, never()).archive(batch, false);
    }
}

package com.calaccess.filings.controller;

import com.calaccess.filings.domain.IngestionFailureEntity;
import com.calaccess.filings.domain.IngestionRunEntity;
import com.calaccess.filings.service.DuplicateRecordException;
import com.calaccess.filings.service.IngestionJobService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(IngestionController.class)
@DisplayName("IngestionController")
class IngestionControllerTest {

    private static final String SUBMISSION = """
        {
          "submissions": [
            {
              "filingId": 1001,
              "amendId": 0,
              "summary": { "fromDate": "2020-01-01", "thruDate": "2020-06-30", "monetaryContributions": 5000 }
            }
          ]
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IngestionJobService ingestionJobService;

    @Test
    @DisplayName("Starts a run under the default source")
    void startsRun() throws Exception {
        UUID runId = UUID.randomUUID();
        when(ingestionJobService.runIngestion(eq("api"), anyList())).thenReturn(runId);

        mockMvc.perform(post("/v1/ingestion/run").contentType(MediaType.APPLICATION_JSON).content(SUBMISSION))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.runId").value(runId.toString()));
    }

    @Test
    @DisplayName("An empty batch is a validation error")
    void rejectsEmptyBatch() throws Exception {
        mockMvc.perform(post("/v1/ingestion/run").contentType(MediaType.APPLICATION_JSON).content("{\"submissions\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"));

        verifyNoInteractions(ingestionJobService);
    }

    @Test
    @DisplayName("A submission without its reporting period is a validation error")
    void rejectsSubmissionWithoutPeriod() throws Exception {
        String body = """
            { "submissions": [ { "filingId": 1001, "amendId": 0, "summary": { "thruDate": "2020-06-30" } } ] }
            """;

        mockMvc.perform(post("/v1/ingestion/run").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"))
            .andExpect(jsonPath("$.message").value(startsWith("submissions[0].summary.fromDate")));
    }

    @Test
    @DisplayName("An unreadable body answers 400")
    void rejectsMalformedBody() throws Exception {
        mockMvc.perform(post("/v1/ingestion/run").contentType(MediaType.APPLICATION_JSON).content("{ nope"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("malformed_request"));
    }

    @Test
    @DisplayName("Duplicate records answer 409")
    void duplicateIsConflict() throws Exception {
        when(ingestionJobService.runIngestion(eq("api"), anyList()))
            .thenThrow(new DuplicateRecordException("Filing version already exists: 1001-0"));

        mockMvc.perform(post("/v1/ingestion/run").contentType(MediaType.APPLICATION_JSON).content(SUBMISSION))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("duplicate_record"));
    }

    @Test
    @DisplayName("Returns a run with its recent failures")
    void getsRun() throws Exception {
        IngestionRunEntity run = IngestionRunEntity.startNew("batch-01.json");
        run.incrementReceived();
        run.incrementFailed();
        run.complete();
        when(ingestionJobService.getRun(run.getRunId())).thenReturn(Optional.of(run));
        when(ingestionJobService.getRunFailures(run.getRunId())).thenReturn(List.of(
            IngestionFailureEntity.of(run.getRunId(), 1001, 0, "MISSING_FIELD", "amount is required")
        ));

        mockMvc.perform(get("/v1/ingestion/runs/{runId}", run.getRunId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FAILED"))
            .andExpect(jsonPath("$.failedCount").value(1))
            .andExpect(jsonPath("$.recentFailures[0].code").value("MISSING_FIELD"))
            .andExpect(jsonPath("$.recentFailures[0].reason").value("amount is required"));
    }

    @Test
    @DisplayName("Unknown runs answer 404")
    void unknownRunIsNotFound() throws Exception {
        UUID runId = UUID.randomUUID();
        when(ingestionJobService.getRun(runId)).thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/ingestion/runs/{runId}", runId))
            .andExpect(status().isNotFound());
    }
}

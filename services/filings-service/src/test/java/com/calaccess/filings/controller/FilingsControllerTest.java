package com.calaccess.filings.controller;

import com.calaccess.filings.domain.Form460FilingEntity;
import com.calaccess.filings.domain.Form460FilingVersionEntity;
import com.calaccess.filings.domain.item.ScheduleAItemEntity;
import com.calaccess.filings.domain.item.ScheduleAItemVersionEntity;
import com.calaccess.filings.service.Form460FilingService;
import com.calaccess.filings.service.RecordNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.calaccess.filings.Form460Fixtures.contribution;
import static com.calaccess.filings.Form460Fixtures.summary;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FilingsController.class)
@DisplayName("FilingsController")
class FilingsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private Form460FilingService filingService;

    @Test
    @DisplayName("Returns the current filing with blank totals as null")
    void getsFiling() throws Exception {
        when(filingService.requireFiling(1001)).thenReturn(Form460FilingEntity.of(1001, 1, summary(6000)));

        mockMvc.perform(get("/v1/filings/1001"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.filingId").value(1001))
            .andExpect(jsonPath("$.amendmentCount").value(1))
            .andExpect(jsonPath("$.summary.monetaryContributions").value(6000))
            .andExpect(jsonPath("$.summary.fromDate").value("2020-01-01"))
            .andExpect(jsonPath("$.summary.loansReceived").value(nullValue()));
    }

    @Test
    @DisplayName("Unknown filings map to 404")
    void unknownFilingIsNotFound() throws Exception {
        when(filingService.requireFiling(404)).thenThrow(new RecordNotFoundException("Filing not found: 404"));

        mockMvc.perform(get("/v1/filings/404"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("not_found"))
            .andExpect(jsonPath("$.message").value("Filing not found: 404"));
    }

    @Test
    @DisplayName("Searches filings by reporting period")
    void searchesFilings() throws Exception {
        when(filingService.searchFilings(LocalDate.of(2020, 1, 1), null, 10))
            .thenReturn(List.of(Form460FilingEntity.of(1001, 0, summary(5000))));

        mockMvc.perform(get("/v1/filings").param("from", "2020-01-01").param("limit", "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].filingId").value(1001));
    }

    @Test
    @DisplayName("Deleting a filing answers 204")
    void deletesFiling() throws Exception {
        mockMvc.perform(delete("/v1/filings/1001"))
            .andExpect(status().isNoContent());

        verify(filingService).deleteFiling(1001);
    }

    @Test
    @DisplayName("Deleting an unknown filing answers 404")
    void deleteUnknownFiling() throws Exception {
        doThrow(new RecordNotFoundException("Filing not found: 404")).when(filingService).deleteFiling(404);

        mockMvc.perform(delete("/v1/filings/404"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Lists versions in amendment order")
    void listsVersions() throws Exception {
        when(filingService.listVersions(1001)).thenReturn(List.of(
            Form460FilingVersionEntity.of(1001, 0, summary(5000)),
            Form460FilingVersionEntity.of(1001, 1, summary(6000))
        ));

        mockMvc.perform(get("/v1/filings/1001/versions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].amendId").value(0))
            .andExpect(jsonPath("$[1].summary.monetaryContributions").value(6000));
    }

    @Test
    @DisplayName("Lists current items of a schedule given in any case")
    void listsCurrentItems() throws Exception {
        doReturn(List.of(ScheduleAItemEntity.of(1001, 1, contribution("2500.00"))))
            .when(filingService).listCurrentItems("A", 1001);

        mockMvc.perform(get("/v1/filings/1001/schedules/a/items"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].schedule").value("A"))
            .andExpect(jsonPath("$[0].filingId").value(1001))
            .andExpect(jsonPath("$[0].lineItem").value(1))
            .andExpect(jsonPath("$[0].fields.amount").value(2500.0))
            .andExpect(jsonPath("$[0].fields.contribution.contributor.lastName").value("Doe"));
    }

    @Test
    @DisplayName("Lists the items of one version")
    void listsVersionItems() throws Exception {
        doReturn(List.of(ScheduleAItemVersionEntity.of(7L, 1, contribution("10.00"))))
            .when(filingService).listVersionItems("E-SUB", 1001, 0);

        mockMvc.perform(get("/v1/filings/1001/versions/0/schedules/e_sub/items"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].schedule").value("E-SUB"))
            .andExpect(jsonPath("$[0].filingVersionId").value(7));
    }

    @Test
    @DisplayName("A missing line item answers 404")
    void missingItemIsNotFound() throws Exception {
        doReturn(Optional.empty()).when(filingService).findCurrentItem("A", 1001, 9);

        mockMvc.perform(get("/v1/filings/1001/schedules/A/items/9"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Schedule A line item 9 not found on filing 1001"));
    }

    @Test
    @DisplayName("An unknown schedule code answers 404")
    void unknownScheduleIsNotFound() throws Exception {
        mockMvc.perform(get("/v1/filings/1001/schedules/Z/items"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Unknown schedule: Z"));
    }

    @Test
    @DisplayName("Invalid arguments from the service answer 400")
    void invalidArgumentIsBadRequest() throws Exception {
        when(filingService.requireVersion(anyInt(), anyInt()))
            .thenThrow(new IllegalArgumentException("amendId must not be negative: -1"));

        mockMvc.perform(get("/v1/filings/1001/versions/-1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }
}

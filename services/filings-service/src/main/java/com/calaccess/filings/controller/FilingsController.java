package com.calaccess.filings.controller;

import com.calaccess.filings.domain.item.Schedule;
import com.calaccess.filings.service.Form460FilingService;
import com.calaccess.filings.service.RecordNotFoundException;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/filings")
public class FilingsController {

    private final Form460FilingService filingService;

    public FilingsController(Form460FilingService filingService) {
        this.filingService = filingService;
    }

    @GetMapping
    public List<FilingResponse> list(
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate thru,
        @RequestParam(defaultValue = "50") int limit
    ) {
        return filingService.searchFilings(from, thru, limit)
            .stream()
            .map(FilingResponse::from)
            .toList();
    }

    @GetMapping("/{filingId}")
    public FilingResponse get(@PathVariable Integer filingId) {
        return FilingResponse.from(filingService.requireFiling(filingId));
    }

    @DeleteMapping("/{filingId}")
    public ResponseEntity<Void> delete(@PathVariable Integer filingId) {
        filingService.deleteFiling(filingId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{filingId}/versions")
    public List<FilingVersionResponse> versions(@PathVariable Integer filingId) {
        return filingService.listVersions(filingId)
            .stream()
            .map(FilingVersionResponse::from)
            .toList();
    }

    @GetMapping("/{filingId}/versions/{amendId}")
    public FilingVersionResponse version(@PathVariable Integer filingId, @PathVariable Integer amendId) {
        return FilingVersionResponse.from(filingService.requireVersion(filingId, amendId));
    }

    @GetMapping("/{filingId}/schedules/{code}/items")
    public List<ItemResponse> items(@PathVariable Integer filingId, @PathVariable String code) {
        String schedule = scheduleCode(code);
        return filingService.listCurrentItems(schedule, filingId)
            .stream()
            .map(item -> ItemResponse.from(schedule, item))
            .toList();
    }

    @GetMapping("/{filingId}/schedules/{code}/items/{lineItem}")
    public ItemResponse item(@PathVariable Integer filingId, @PathVariable String code, @PathVariable Integer lineItem) {
        String schedule = scheduleCode(code);
        return filingService.findCurrentItem(schedule, filingId, lineItem)
            .map(item -> ItemResponse.from(schedule, item))
            .orElseThrow(() -> new RecordNotFoundException(
                "Schedule " + schedule + " line item " + lineItem + " not found on filing " + filingId));
    }

    @GetMapping("/{filingId}/versions/{amendId}/schedules/{code}/items")
    public List<ItemResponse> versionItems(
        @PathVariable Integer filingId,
        @PathVariable Integer amendId,
        @PathVariable String code
    ) {
        String schedule = scheduleCode(code);
        return filingService.listVersionItems(schedule, filingId, amendId)
            .stream()
            .map(item -> ItemResponse.from(schedule, item))
            .toList();
    }

    private String scheduleCode(String code) {
        return Schedule.fromCode(code)
            .map(schedule -> schedule.code())
            .orElseThrow(() -> new RecordNotFoundException("Unknown schedule: " + code));
    }
}

package com.calaccess.filings.controller;

import com.calaccess.filings.domain.Form460FilingEntity;
import com.calaccess.filings.domain.Form460Summary;
import java.time.Instant;

public record FilingResponse(
    Integer filingId,
    int amendmentCount,
    Form460Summary summary,
    Instant createdAt,
    Instant updatedAt
) {
    public static FilingResponse from(Form460FilingEntity entity) {
        return new FilingResponse(
            entity.getFilingId(),
            entity.getAmendmentCount(),
            entity.getSummary(),
            entity.getCreatedAt(),
            entity.getUpdatedAt()
        );
    }
}

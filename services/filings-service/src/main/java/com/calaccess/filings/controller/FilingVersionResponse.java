package com.calaccess.filings.controller;

import com.calaccess.filings.domain.Form460FilingVersionEntity;
import com.calaccess.filings.domain.Form460Summary;
import java.time.Instant;

public record FilingVersionResponse(
    Long id,
    Integer filingId,
    Integer amendId,
    Form460Summary summary,
    Instant createdAt
) {
    public static FilingVersionResponse from(Form460FilingVersionEntity entity) {
        return new FilingVersionResponse(
            entity.getId(),
            entity.getFilingId(),
            entity.getAmendId(),
            entity.getSummary(),
            entity.getCreatedAt()
        );
    }
}

package com.calaccess.filings.controller;

import com.calaccess.filings.domain.item.FilingItem;
import com.calaccess.filings.domain.item.FilingVersionItem;

public record ItemResponse(
    String schedule,
    Long id,
    Integer filingId,
    Long filingVersionId,
    Integer lineItem,
    Object fields
) {
    public static ItemResponse from(String schedule, FilingItem<?> item) {
        return new ItemResponse(schedule, item.getId(), item.getFilingId(), null, item.getLineItem(), item.getFields());
    }

    public static ItemResponse from(String schedule, FilingVersionItem<?> item) {
        return new ItemResponse(schedule, item.getId(), null, item.getFilingVersionId(), item.getLineItem(), item.getFields());
    }
}

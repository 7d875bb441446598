package com.calaccess.filings.domain;

public enum UpsertResult {
    // no current filing existed; the amendment created it
    INSERTED,
    // the amendment is the latest and overwrote the current filing
    UPDATED,
    // an older amendment arrived late; only its version was recorded
    SKIPPED;

    public boolean isInsertOrUpdate() {
        return this == INSERTED || this == UPDATED;
    }
}

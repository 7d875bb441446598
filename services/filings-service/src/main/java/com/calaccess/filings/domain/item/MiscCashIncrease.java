package com.calaccess.filings.domain.item;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import java.math.BigDecimal;

// Schedule I, from RCPT_CD where FORM_TYPE is 'I'
@Embeddable
public record MiscCashIncrease(
    @Embedded
    ContributionFields contribution,

    // RCPT_CD.AMOUNT
    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    BigDecimal amount,

    // RCPT_CD.CTRIB_DSCR
    @Column(name = "receipt_description", length = 90)
    String receiptDescription
) implements ItemizedFields {
}

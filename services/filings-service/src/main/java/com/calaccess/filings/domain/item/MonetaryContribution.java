package com.calaccess.filings.domain.item;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import java.math.BigDecimal;

// Schedule A, from RCPT_CD where FORM_TYPE is 'A' or 'A-1'
@Embeddable
public record MonetaryContribution(
    @Embedded
    ContributionFields contribution,

    // RCPT_CD.AMOUNT received in the period covered by the filing
    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    BigDecimal amount
) implements ItemizedFields {
}

package com.calaccess.filings.domain.item;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import java.math.BigDecimal;

// Schedule C, from RCPT_CD where FORM_TYPE is 'C'
@Embeddable
public record NonmonetaryContribution(
    @Embedded
    ContributionFields contribution,

    // RCPT_CD.AMOUNT: what the goods or services would cost on the open market
    @Column(name = "fair_market_value", nullable = false, precision = 14, scale = 2)
    BigDecimal fairMarketValue,

    // RCPT_CD.CTRIB_DSCR
    @Column(name = "contribution_description", length = 90)
    String contributionDescription
) implements ItemizedFields {

    @Override
    public BigDecimal amount() {
        return fairMarketValue;
    }
}

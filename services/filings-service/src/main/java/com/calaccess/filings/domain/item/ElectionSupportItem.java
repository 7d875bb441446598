package com.calaccess.filings.domain.item;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import java.math.BigDecimal;

// Schedule D, from EXPN_CD where FORM_TYPE is 'D'
@Embeddable
public record ElectionSupportItem(
    @Embedded
    ExpenditureFields expenditure,

    // EXPN_CD.CUM_OTH: cumulative amount given this election cycle when the candidate is subject
    // to contribution limits
    @Column(name = "cumulative_election_amount", precision = 14, scale = 2)
    BigDecimal cumulativeElectionAmount
) implements ItemizedFields {

    @Override
    public BigDecimal amount() {
        return expenditure == null ? null : expenditure.amount();
    }
}

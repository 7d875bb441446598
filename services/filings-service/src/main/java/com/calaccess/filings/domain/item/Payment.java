package com.calaccess.filings.domain.item;

import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import java.math.BigDecimal;

/**
 * Payment made by the filer, itemized on Schedule E.
 *
 * <p>Excludes interest paid on loans, loans made to others, transfers into savings accounts,
 * payments made by agents or contractors on behalf of the filer, certificates of deposit, money
 * market accounts and other assets readily converted to cash. Derived from EXPN_CD records where
 * FORM_TYPE is 'E'.
 */
@Embeddable
public record Payment(
    @Embedded
    ExpenditureFields expenditure
) implements ItemizedFields {

    @Override
    public BigDecimal amount() {
        return expenditure == null ? null : expenditure.amount();
    }
}

package com.calaccess.filings.domain.item;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import java.math.BigDecimal;

/**
 * Memo entry whose amount is lumped into a parent payment reported elsewhere on Schedule E.
 *
 * <p>Includes payments summarized on Schedule D, vendor payments over $100 inside credit card
 * payments, agent payments reported on E instead of G, and payments on accrued expenses from
 * Schedule F. Derived from EXPN_CD records where FORM_TYPE is 'E' and MEMO_CODE is set.
 */
@Embeddable
public record PaymentSubItem(
    @Embedded
    ExpenditureFields expenditure,

    // EXPN_CD.BAKREF_TID
    @Column(name = "parent_transaction_id", length = 20)
    String parentTransactionId
) implements ItemizedFields {

    @Override
    public BigDecimal amount() {
        return expenditure == null ? null : expenditure.amount();
    }
}

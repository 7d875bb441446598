package com.calaccess.filings.domain.item;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import java.math.BigDecimal;
import java.time.LocalDate;

// payment fields shared by Schedules D, E and G (EXPN_CD)
@Embeddable
public record ExpenditureFields(
    // EXPN_CD.TRAN_ID
    @Column(name = "transaction_id", length = 20)
    String transactionId,

    // EXPN_CD.MEMO_REFNO
    @Column(name = "memo_reference_number", length = 20)
    String memoReferenceNumber,

    // EXPN_CD.EXPN_DATE
    @Column(name = "expenditure_date")
    LocalDate expenditureDate,

    // EXPN_CD.ENTITY_CD
    @Column(name = "payee_code", length = 3)
    String payeeCode,

    // EXPN_CD.CMTE_ID
    @Column(name = "payee_committee_id", length = 9)
    String payeeCommitteeId,

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "title", column = @Column(name = "payee_title", length = 10)),
        @AttributeOverride(name = "lastName", column = @Column(name = "payee_last_name", length = 200)),
        @AttributeOverride(name = "firstName", column = @Column(name = "payee_first_name", length = 45)),
        @AttributeOverride(name = "suffix", column = @Column(name = "payee_name_suffix", length = 10))
    })
    PersonName payee,

    @Column(name = "payee_city", length = 30)
    String payeeCity,

    @Column(name = "payee_state", length = 2)
    String payeeState,

    @Column(name = "payee_zip", length = 10)
    String payeeZip,

    // EXPN_CD.EXPN_CODE, e.g. CMP, CNS, LIT
    @Column(name = "expense_code", length = 3)
    String expenseCode,

    // EXPN_CD.EXPN_DSCR
    @Column(name = "payment_description", length = 400)
    String paymentDescription,

    // EXPN_CD.AMOUNT
    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    BigDecimal amount,

    // EXPN_CD.CUM_YTD
    @Column(name = "cumulative_ytd_amount", precision = 14, scale = 2)
    BigDecimal cumulativeYtdAmount,

    // EXPN_CD.SUP_OPP_CD: S or O
    @Column(name = "support_oppose_code", length = 1)
    String supportOpposeCode,

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "title", column = @Column(name = "candidate_title", length = 10)),
        @AttributeOverride(name = "lastName", column = @Column(name = "candidate_last_name", length = 200)),
        @AttributeOverride(name = "firstName", column = @Column(name = "candidate_first_name", length = 45)),
        @AttributeOverride(name = "suffix", column = @Column(name = "candidate_name_suffix", length = 10))
    })
    PersonName candidate,

    // EXPN_CD.BAL_NAME
    @Column(name = "ballot_measure_name", length = 200)
    String ballotMeasureName,

    // EXPN_CD.BAL_NUM
    @Column(name = "ballot_measure_number", length = 7)
    String ballotMeasureNumber,

    // EXPN_CD.BAL_JURIS
    @Column(name = "ballot_measure_jurisdiction", length = 40)
    String ballotMeasureJurisdiction
) {

    public static ExpenditureFields from(String transactionId, LocalDate expenditureDate, PersonName payee, BigDecimal amount) {
        return new ExpenditureFields(
            transactionId, null, expenditureDate, null, null, payee, null, null, null,
            null, null, amount, null, null, null, null, null, null
        );
    }
}

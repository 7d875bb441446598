package com.calaccess.filings.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

/**
 * Cover sheet and summary page of a Form 460 campaign disclosure statement.
 *
 * <p>Shared by the current filing and every version of it. Totals are whole dollars as reported on
 * the summary page (from SMRY_CD) and stay {@code null} where the line was left blank.
 */
@Embeddable
public record Form460Summary(
    // CVR_CAMPAIGN_DISCLOSURE_CD.FILER_ID
    @Column(name = "filer_id", length = 9)
    String filerId,

    // CVR_CAMPAIGN_DISCLOSURE_CD.FILER_NAML
    @Column(name = "filer_name", length = 200)
    String filerName,

    // CVR_CAMPAIGN_DISCLOSURE_CD.RPT_DATE
    @Column(name = "date_filed")
    LocalDate dateFiled,

    // CVR_CAMPAIGN_DISCLOSURE_CD.FROM_DATE
    @NotNull
    @Column(name = "from_date", nullable = false)
    LocalDate fromDate,

    // CVR_CAMPAIGN_DISCLOSURE_CD.THRU_DATE
    @NotNull
    @Column(name = "thru_date", nullable = false)
    LocalDate thruDate,

    // line 1, column A
    @Column(name = "monetary_contributions")
    Integer monetaryContributions,

    // line 2
    @Column(name = "loans_received")
    Integer loansReceived,

    // line 3: lines 1 and 2 combined
    @Column(name = "subtotal_cash_contributions")
    Integer subtotalCashContributions,

    // line 4
    @Column(name = "nonmonetary_contributions")
    Integer nonmonetaryContributions,

    // line 5
    @Column(name = "total_contributions")
    Integer totalContributions,

    // line 6
    @Column(name = "payments_made")
    Integer paymentsMade,

    // line 7
    @Column(name = "loans_made")
    Integer loansMade,

    // line 8
    @Column(name = "subtotal_cash_payments")
    Integer subtotalCashPayments,

    // line 9: accrued expenses
    @Column(name = "unpaid_bills")
    Integer unpaidBills,

    // line 10, equal to line 4
    @Column(name = "nonmonetary_adjustment")
    Integer nonmonetaryAdjustment,

    // line 11
    @Column(name = "total_expenditures_made")
    Integer totalExpendituresMade,

    // line 12, the ending cash balance of the previous statement
    @Column(name = "begin_cash_balance")
    Integer beginCashBalance,

    // line 13
    @Column(name = "cash_receipts")
    Integer cashReceipts,

    // line 14
    @Column(name = "miscellaneous_cash_increases")
    Integer miscellaneousCashIncreases,

    // line 15
    @Column(name = "cash_payments")
    Integer cashPayments,

    // line 16
    @Column(name = "ending_cash_balance")
    Integer endingCashBalance,

    // line 17
    @Column(name = "loan_guarantees_received")
    Integer loanGuaranteesReceived,

    // line 18, includes loans made to others
    @Column(name = "cash_equivalents")
    Integer cashEquivalents,

    // line 19
    @Column(name = "outstanding_debts")
    Integer outstandingDebts
) {

    /**
     * A summary covering the given reporting period with every total left blank.
     */
    public static Form460Summary forPeriod(LocalDate fromDate, LocalDate thruDate) {
        return new Form460Summary(
            null, null, null, fromDate, thruDate,
            null, null, null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null
        );
    }

    public Form460Summary withMonetaryContributions(Integer value) {
        return new Form460Summary(
            filerId, filerName, dateFiled, fromDate, thruDate,
            value, loansReceived, subtotalCashContributions, nonmonetaryContributions, totalContributions,
            paymentsMade, loansMade, subtotalCashPayments, unpaidBills, nonmonetaryAdjustment,
            totalExpendituresMade, beginCashBalance, cashReceipts, miscellaneousCashIncreases, cashPayments,
            endingCashBalance, loanGuaranteesReceived, cashEquivalents, outstandingDebts
        );
    }
}

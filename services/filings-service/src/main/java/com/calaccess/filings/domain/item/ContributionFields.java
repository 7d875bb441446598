package com.calaccess.filings.domain.item;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import java.math.BigDecimal;
import java.time.LocalDate;

// receipt fields shared by Schedules A, C and I (RCPT_CD)
@Embeddable
public record ContributionFields(
    // RCPT_CD.TRAN_ID
    @Column(name = "transaction_id", length = 20)
    String transactionId,

    // RCPT_CD.MEMO_REFNO
    @Column(name = "memo_reference_number", length = 20)
    String memoReferenceNumber,

    // RCPT_CD.RCPT_DATE
    @Column(name = "date_received")
    LocalDate dateReceived,

    // RCPT_CD.DATE_THRU, set when the receipt spans a range of dates
    @Column(name = "date_received_thru")
    LocalDate dateReceivedThru,

    // RCPT_CD.ENTITY_CD: IND, COM, OTH, PTY or SCC
    @Column(name = "contributor_code", length = 3)
    String contributorCode,

    // RCPT_CD.CMTE_ID
    @Column(name = "contributor_committee_id", length = 9)
    String contributorCommitteeId,

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "title", column = @Column(name = "contributor_title", length = 10)),
        @AttributeOverride(name = "lastName", column = @Column(name = "contributor_last_name", length = 200)),
        @AttributeOverride(name = "firstName", column = @Column(name = "contributor_first_name", length = 45)),
        @AttributeOverride(name = "suffix", column = @Column(name = "contributor_name_suffix", length = 10))
    })
    PersonName contributor,

    @Column(name = "contributor_city", length = 30)
    String contributorCity,

    @Column(name = "contributor_state", length = 2)
    String contributorState,

    @Column(name = "contributor_zip", length = 10)
    String contributorZip,

    @Column(name = "contributor_employer", length = 200)
    String contributorEmployer,

    @Column(name = "contributor_occupation", length = 60)
    String contributorOccupation,

    // RCPT_CD.CTRIB_SELF
    @Column(name = "contributor_is_self_employed")
    Boolean contributorIsSelfEmployed,

    // RCPT_CD.INTR_CMTEID
    @Column(name = "intermediary_committee_id", length = 9)
    String intermediaryCommitteeId,

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "title", column = @Column(name = "intermediary_title", length = 10)),
        @AttributeOverride(name = "lastName", column = @Column(name = "intermediary_last_name", length = 200)),
        @AttributeOverride(name = "firstName", column = @Column(name = "intermediary_first_name", length = 45)),
        @AttributeOverride(name = "suffix", column = @Column(name = "intermediary_name_suffix", length = 10))
    })
    PersonName intermediary,

    // RCPT_CD.CUM_YTD
    @Column(name = "cumulative_ytd_amount", precision = 14, scale = 2)
    BigDecimal cumulativeYtdAmount
) {

    public static ContributionFields from(String transactionId, LocalDate dateReceived, String contributorCode, PersonName contributor) {
        return new ContributionFields(
            transactionId, null, dateReceived, null, contributorCode, null, contributor,
            null, null, null, null, null, null, null, null, null
        );
    }
}

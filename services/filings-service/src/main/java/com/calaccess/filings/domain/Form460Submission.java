package com.calaccess.filings.domain;

import com.calaccess.filings.domain.item.AgentPayment;
import com.calaccess.filings.domain.item.ElectionSupportItem;
import com.calaccess.filings.domain.item.ItemizedLine;
import com.calaccess.filings.domain.item.MiscCashIncrease;
import com.calaccess.filings.domain.item.MonetaryContribution;
import com.calaccess.filings.domain.item.NonmonetaryContribution;
import com.calaccess.filings.domain.item.Payment;
import com.calaccess.filings.domain.item.PaymentSubItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record Form460Submission(
    @NotNull
    Integer filingId,

    @NotNull
    @Min(0)
    Integer amendId,

    @NotNull
    @Valid
    Form460Summary summary,

    List<ItemizedLine<MonetaryContribution>> scheduleA,
    List<ItemizedLine<NonmonetaryContribution>> scheduleC,
    List<ItemizedLine<ElectionSupportItem>> scheduleD,
    List<ItemizedLine<Payment>> scheduleE,
    List<ItemizedLine<PaymentSubItem>> scheduleESub,
    List<ItemizedLine<AgentPayment>> scheduleG,
    List<ItemizedLine<MiscCashIncrease>> scheduleI
) {

    public static Form460Submission summaryOnly(Integer filingId, Integer amendId, Form460Summary summary) {
        return new Form460Submission(filingId, amendId, summary, null, null, null, null, null, null, null);
    }
}

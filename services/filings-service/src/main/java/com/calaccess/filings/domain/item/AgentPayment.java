package com.calaccess.filings.domain.item;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.math.BigDecimal;

// Schedule G, from EXPN_CD where FORM_TYPE is 'G'
@Embeddable
public record AgentPayment(
    @Embedded
    ExpenditureFields expenditure,

    // EXPN_CD.BAKREF_TID
    @Column(name = "parent_transaction_id", length = 20)
    String parentTransactionId,

    // EXPN_CD.AGENT_NAMT, AGENT_NAML, AGENT_NAMF and AGENT_NAMS
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "title", column = @Column(name = "agent_title", length = 10)),
        @AttributeOverride(name = "lastName", column = @Column(name = "agent_last_name", length = 200)),
        @AttributeOverride(name = "firstName", column = @Column(name = "agent_first_name", length = 45)),
        @AttributeOverride(name = "suffix", column = @Column(name = "agent_name_suffix", length = 10))
    })
    PersonName agent,

    // EXPN_CD.G_FROM_E_F
    @Enumerated(EnumType.STRING)
    @Column(name = "parent_schedule", length = 1)
    ParentSchedule parentSchedule
) implements ItemizedFields {

    @Override
    public BigDecimal amount() {
        return expenditure == null ? null : expenditure.amount();
    }
}

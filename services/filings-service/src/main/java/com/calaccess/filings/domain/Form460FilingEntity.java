package com.calaccess.filings.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.Instant;
import org.springframework.data.domain.Persistable;

/**
 * The most recent version of a Form 460 filing.
 *
 * <p>Holds the cover sheet and summary page of the latest amendment. Every amendment, including
 * the original, is kept separately as a {@link Form460FilingVersionEntity}.
 */
@Entity
@Table(
    name = "form460_filings",
    indexes = {
        @Index(name = "ix_form460_filings_amendment_count", columnList = "amendment_count"),
        @Index(name = "ix_form460_filings_filing_amendment", columnList = "filing_id, amendment_count"),
        @Index(name = "ix_form460_filings_from_date", columnList = "from_date"),
        @Index(name = "ix_form460_filings_thru_date", columnList = "thru_date")
    }
)
public class Form460FilingEntity implements Persistable<Integer> {

    // CVR_CAMPAIGN_DISCLOSURE_CD.FILING_ID
    @Id
    @Column(name = "filing_id", nullable = false, updatable = false)
    private Integer filingId;

    // highest CVR_CAMPAIGN_DISCLOSURE_CD.AMEND_ID seen
    @Column(name = "amendment_count", nullable = false)
    private int amendmentCount;

    @Embedded
    private Form460Summary summary;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // assigned id: a new filing is persisted, so an existing filing_id fails on the primary key
    @Transient
    private boolean isNew = true;

    public static Form460FilingEntity of(Integer filingId, int amendmentCount, Form460Summary summary) {
        Form460FilingEntity entity = new Form460FilingEntity();
        entity.filingId = filingId;
        entity.amendmentCount = amendmentCount;
        entity.summary = summary;
        return entity;
    }

    /**
     * Overwrites this filing with the data of a later amendment.
     */
    public void supersede(int amendId, Form460Summary summary) {
        this.amendmentCount = amendId;
        this.summary = summary;
    }

    public boolean isSupersededBy(int amendId) {
        return amendId >= amendmentCount;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    @Override
    public Integer getId() {
        return filingId;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    public Integer getFilingId() {
        return filingId;
    }

    public int getAmendmentCount() {
        return amendmentCount;
    }

    public Form460Summary getSummary() {
        return summary;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return String.valueOf(filingId);
    }
}

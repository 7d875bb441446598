package com.calaccess.filings.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;

@Entity
@Table(
    name = "form460_filing_versions",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_form460_filing_versions_filing_amend",
        columnNames = {"filing_id", "amend_id"}
    ),
    indexes = {
        @Index(name = "ix_form460_filing_versions_filing_amend", columnList = "filing_id, amend_id"),
        @Index(name = "ix_form460_filing_versions_from_date", columnList = "from_date"),
        @Index(name = "ix_form460_filing_versions_thru_date", columnList = "thru_date")
    }
)
public class Form460FilingVersionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    // CVR_CAMPAIGN_DISCLOSURE_CD.FILING_ID
    @Column(name = "filing_id")
    private Integer filingId;

    // CVR_CAMPAIGN_DISCLOSURE_CD.AMEND_ID
    @Column(name = "amend_id", nullable = false, updatable = false)
    private Integer amendId;

    @Embedded
    private Form460Summary summary;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static Form460FilingVersionEntity of(Integer filingId, Integer amendId, Form460Summary summary) {
        Form460FilingVersionEntity entity = new Form460FilingVersionEntity();
        entity.filingId = filingId;
        entity.amendId = amendId;
        entity.summary = summary;
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public Long getId() {
        return id;
    }

    public Integer getFilingId() {
        return filingId;
    }

    public Integer getAmendId() {
        return amendId;
    }

    public Form460Summary getSummary() {
        return summary;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return filingId + "-" + amendId;
    }
}

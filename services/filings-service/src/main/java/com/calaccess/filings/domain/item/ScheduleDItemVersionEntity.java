package com.calaccess.filings.domain.item;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(
    name = "form460_schedule_d_item_versions",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_form460_schedule_d_item_versions_version_line",
        columnNames = {"filing_version_id", "line_item"}
    ),
    indexes = @Index(
        name = "ix_form460_schedule_d_item_versions_version_line",
        columnList = "filing_version_id, line_item"
    )
)
public class ScheduleDItemVersionEntity implements FilingVersionItem<ElectionSupportItem> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "filing_version_id")
    private Long filingVersionId;

    @Column(name = "line_item", nullable = false, updatable = false)
    private Integer lineItem;

    @Embedded
    private ElectionSupportItem fields;

    public static ScheduleDItemVersionEntity of(Long filingVersionId, Integer lineItem, ElectionSupportItem fields) {
        ScheduleDItemVersionEntity entity = new ScheduleDItemVersionEntity();
        entity.filingVersionId = filingVersionId;
        entity.lineItem = lineItem;
        entity.fields = fields;
        return entity;
    }

    @Override
    public Long getId() {
        return id;
    }

    @Override
    public Long getFilingVersionId() {
        return filingVersionId;
    }

    @Override
    public Integer getLineItem() {
        return lineItem;
    }

    @Override
    public ElectionSupportItem getFields() {
        return fields;
    }

    @Override
    public String toString() {
        return filingVersionId + "-" + lineItem;
    }
}

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
    name = "form460_schedule_d_items",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_form460_schedule_d_items_filing_line",
        columnNames = {"filing_id", "line_item"}
    ),
    indexes = @Index(name = "ix_form460_schedule_d_items_filing_line", columnList = "filing_id, line_item")
)
public class ScheduleDItemEntity implements FilingItem<ElectionSupportItem> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "filing_id")
    private Integer filingId;

    @Column(name = "line_item", nullable = false, updatable = false)
    private Integer lineItem;

    @Embedded
    private ElectionSupportItem fields;

    public static ScheduleDItemEntity of(Integer filingId, Integer lineItem, ElectionSupportItem fields) {
        ScheduleDItemEntity entity = new ScheduleDItemEntity();
        entity.filingId = filingId;
        entity.lineItem = lineItem;
        entity.fields = fields;
        return entity;
    }

    @Override
    public Long getId() {
        return id;
    }

    @Override
    public Integer getFilingId() {
        return filingId;
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
        return filingId + "-" + lineItem;
    }
}

package com.calaccess.filings.domain.item;

/**
 * An itemized transaction on the most recent version of a filing.
 *
 * @param <D> schedule-specific payload
 */
public interface FilingItem<D extends ItemizedFields> {

    Long getId();

    Integer getFilingId();

    Integer getLineItem();

    D getFields();
}

package com.calaccess.filings.domain.item;

public interface FilingVersionItem<D extends ItemizedFields> {

    Long getId();

    Long getFilingVersionId();

    Integer getLineItem();

    D getFields();
}

package com.calaccess.filings.domain.item;

public record ItemizedLine<D extends ItemizedFields>(Integer lineItem, D fields) {
}

package com.calaccess.filings.domain.item;

import java.math.BigDecimal;

/**
 * Schedule-specific payload of an itemized transaction.
 */
public interface ItemizedFields {

    BigDecimal amount();
}

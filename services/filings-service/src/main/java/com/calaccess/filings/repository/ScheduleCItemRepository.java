package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleCItemEntity;

public interface ScheduleCItemRepository extends FilingItemRepository<ScheduleCItemEntity> {
}

package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleDItemEntity;

public interface ScheduleDItemRepository extends FilingItemRepository<ScheduleDItemEntity> {
}

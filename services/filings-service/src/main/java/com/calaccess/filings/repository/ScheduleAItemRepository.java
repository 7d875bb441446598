package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleAItemEntity;

public interface ScheduleAItemRepository extends FilingItemRepository<ScheduleAItemEntity> {
}

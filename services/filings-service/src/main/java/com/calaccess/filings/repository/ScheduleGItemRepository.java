package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleGItemEntity;

public interface ScheduleGItemRepository extends FilingItemRepository<ScheduleGItemEntity> {
}

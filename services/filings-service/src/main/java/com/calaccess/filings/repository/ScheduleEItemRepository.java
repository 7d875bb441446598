package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleEItemEntity;

public interface ScheduleEItemRepository extends FilingItemRepository<ScheduleEItemEntity> {
}

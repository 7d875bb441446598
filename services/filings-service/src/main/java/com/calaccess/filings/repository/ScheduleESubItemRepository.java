package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleESubItemEntity;

public interface ScheduleESubItemRepository extends FilingItemRepository<ScheduleESubItemEntity> {
}

package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleIItemEntity;

public interface ScheduleIItemRepository extends FilingItemRepository<ScheduleIItemEntity> {
}

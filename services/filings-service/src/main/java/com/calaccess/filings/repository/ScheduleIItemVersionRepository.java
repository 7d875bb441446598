package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleIItemVersionEntity;

public interface ScheduleIItemVersionRepository extends FilingVersionItemRepository<ScheduleIItemVersionEntity> {
}

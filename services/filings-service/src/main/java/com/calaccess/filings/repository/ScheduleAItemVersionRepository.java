package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleAItemVersionEntity;

public interface ScheduleAItemVersionRepository extends FilingVersionItemRepository<ScheduleAItemVersionEntity> {
}

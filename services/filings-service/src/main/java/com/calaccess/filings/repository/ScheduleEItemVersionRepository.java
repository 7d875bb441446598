package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleEItemVersionEntity;

public interface ScheduleEItemVersionRepository extends FilingVersionItemRepository<ScheduleEItemVersionEntity> {
}

package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleGItemVersionEntity;

public interface ScheduleGItemVersionRepository extends FilingVersionItemRepository<ScheduleGItemVersionEntity> {
}

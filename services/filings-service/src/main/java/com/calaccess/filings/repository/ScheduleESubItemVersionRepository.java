package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleESubItemVersionEntity;

public interface ScheduleESubItemVersionRepository extends FilingVersionItemRepository<ScheduleESubItemVersionEntity> {
}

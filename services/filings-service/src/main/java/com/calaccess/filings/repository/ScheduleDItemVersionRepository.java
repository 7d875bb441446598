package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleDItemVersionEntity;

public interface ScheduleDItemVersionRepository extends FilingVersionItemRepository<ScheduleDItemVersionEntity> {
}

package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.ScheduleCItemVersionEntity;

public interface ScheduleCItemVersionRepository extends FilingVersionItemRepository<ScheduleCItemVersionEntity> {
}

package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.FilingVersionItem;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

@NoRepositoryBean
public interface FilingVersionItemRepository<T extends FilingVersionItem<?>> extends JpaRepository<T, Long> {

    Optional<T> findByFilingVersionIdAndLineItem(Long filingVersionId, Integer lineItem);

    boolean existsByFilingVersionIdAndLineItem(Long filingVersionId, Integer lineItem);

    List<T> findByFilingVersionIdOrderByLineItemAsc(Long filingVersionId);

    long countByFilingVersionId(Long filingVersionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update #{#entityName} i set i.filingVersionId = null where i.filingVersionId = :filingVersionId")
    int detachFromVersion(@Param("filingVersionId") Long filingVersionId);
}

package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.FilingItem;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

@NoRepositoryBean
public interface FilingItemRepository<T extends FilingItem<?>> extends JpaRepository<T, Long> {

    Optional<T> findByFilingIdAndLineItem(Integer filingId, Integer lineItem);

    boolean existsByFilingIdAndLineItem(Integer filingId, Integer lineItem);

    List<T> findByFilingIdOrderByLineItemAsc(Integer filingId);

    long countByFilingId(Integer filingId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update #{#entityName} i set i.filingId = null where i.filingId = :filingId")
    int detachFromFiling(@Param("filingId") Integer filingId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from #{#entityName} i where i.filingId = :filingId")
    int deleteAllOfFiling(@Param("filingId") Integer filingId);
}

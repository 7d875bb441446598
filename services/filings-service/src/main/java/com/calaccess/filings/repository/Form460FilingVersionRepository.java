package com.calaccess.filings.repository;

import com.calaccess.filings.domain.Form460FilingVersionEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface Form460FilingVersionRepository extends JpaRepository<Form460FilingVersionEntity, Long> {

    Optional<Form460FilingVersionEntity> findByFilingIdAndAmendId(Integer filingId, Integer amendId);

    boolean existsByFilingIdAndAmendId(Integer filingId, Integer amendId);

    List<Form460FilingVersionEntity> findByFilingIdOrderByAmendIdAsc(Integer filingId);

    @Query("select max(v.amendId) from Form460FilingVersionEntity v where v.filingId = :filingId")
    Optional<Integer> findMaxAmendId(@Param("filingId") Integer filingId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Form460FilingVersionEntity v set v.filingId = null where v.filingId = :filingId")
    int detachFromFiling(@Param("filingId") Integer filingId);
}

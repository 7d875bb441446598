package com.calaccess.filings.repository;

import com.calaccess.filings.domain.Form460FilingEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface Form460FilingRepository extends JpaRepository<Form460FilingEntity, Integer> {

    @Query("""
        select f from Form460FilingEntity f
        where (:from is null or f.summary.thruDate >= :from)
          and (:thru is null or f.summary.fromDate <= :thru)
        order by f.summary.thruDate desc, f.filingId desc
        """)
    List<Form460FilingEntity> search(
        @Param("from") LocalDate from,
        @Param("thru") LocalDate thru,
        Pageable pageable
    );
}

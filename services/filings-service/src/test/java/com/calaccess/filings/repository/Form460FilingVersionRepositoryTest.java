package com.calaccess.filings.repository;

import com.calaccess.filings.domain.Form460FilingEntity;
import com.calaccess.filings.domain.Form460FilingVersionEntity;
import com.calaccess.filings.domain.Form460Summary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;

import static com.calaccess.filings.Form460Fixtures.summary;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Storage of filings and their versions: blank totals, amendment lookups, the
 * (filing_id, amend_id) unique key and orphaning of versions.
 */
@DataJpaTest
@ActiveProfiles("test")
@DisplayName("Form 460 filing and version repositories")
class Form460FilingVersionRepositoryTest {

    @Autowired
    private Form460FilingRepository filingRepository;

    @Autowired
    private Form460FilingVersionRepository versionRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("Blank summary totals are stored and read back as null")
    void blankTotalsRoundTrip() {
        filingRepository.saveAndFlush(Form460FilingEntity.of(1001, 0, summary(5000)));
        entityManager.clear();

        Form460FilingEntity loaded = filingRepository.findById(1001).orElseThrow();
        Form460Summary stored = loaded.getSummary();

        assertThat(stored.monetaryContributions()).isEqualTo(5000);
        assertThat(stored.loansReceived()).isNull();
        assertThat(stored.endingCashBalance()).isNull();
        assertThat(stored.fromDate()).isEqualTo(LocalDate.of(2020, 1, 1));
        assertThat(loaded.getAmendmentCount()).isZero();
        assertThat(loaded.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("Versions are listed by amendment and the highest amendment is reported")
    void listsVersionsInAmendmentOrder() {
        versionRepository.save(Form460FilingVersionEntity.of(1001, 2, summary(7000)));
        versionRepository.save(Form460FilingVersionEntity.of(1001, 0, summary(5000)));
        versionRepository.save(Form460FilingVersionEntity.of(1001, 1, summary(6000)));
        versionRepository.save(Form460FilingVersionEntity.of(2002, 4, summary(10)));
        versionRepository.flush();

        assertThat(versionRepository.findByFilingIdOrderByAmendIdAsc(1001))
            .extracting(Form460FilingVersionEntity::getAmendId)
            .containsExactly(0, 1, 2);
        assertThat(versionRepository.findMaxAmendId(1001)).contains(2);
        assertThat(versionRepository.findMaxAmendId(3003)).isEmpty();
        assertThat(versionRepository.existsByFilingIdAndAmendId(1001, 1)).isTrue();
        assertThat(versionRepository.existsByFilingIdAndAmendId(1001, 3)).isFalse();
    }

    @Test
    @DisplayName("Detaching a filing nulls the reference but keeps the versions")
    void detachKeepsVersions() {
        Form460FilingVersionEntity original = versionRepository.saveAndFlush(
            Form460FilingVersionEntity.of(1001, 0, summary(5000)));
        versionRepository.saveAndFlush(Form460FilingVersionEntity.of(2002, 0, summary(10)));

        int detached = versionRepository.detachFromFiling(1001);

        assertThat(detached).isEqualTo(1);
        Form460FilingVersionEntity orphan = versionRepository.findById(original.getId()).orElseThrow();
        assertThat(orphan.getFilingId()).isNull();
        assertThat(orphan.getAmendId()).isZero();
        assertThat(orphan.getSummary().monetaryContributions()).isEqualTo(5000);
        assertThat(versionRepository.findByFilingIdOrderByAmendIdAsc(2002)).hasSize(1);
    }

    @Test
    @DisplayName("Search returns filings whose period overlaps the range, latest first")
    void searchesByReportingPeriod() {
        filingRepository.save(Form460FilingEntity.of(1, 0,
            Form460Summary.forPeriod(LocalDate.of(2015, 1, 1), LocalDate.of(2015, 6, 30))));
        filingRepository.save(Form460FilingEntity.of(2, 0,
            Form460Summary.forPeriod(LocalDate.of(2015, 7, 1), LocalDate.of(2015, 12, 31))));
        filingRepository.save(Form460FilingEntity.of(3, 0,
            Form460Summary.forPeriod(LocalDate.of(2016, 1, 1), LocalDate.of(2016, 6, 30))));
        filingRepository.flush();

        assertThat(filingRepository.search(LocalDate.of(2015, 10, 1), null,
                PageRequest.of(0, 10)))
            .extracting(Form460FilingEntity::getFilingId)
            .containsExactly(3, 2);
        assertThat(filingRepository.search(null, null, PageRequest.of(0, 2)))
            .extracting(Form460FilingEntity::getFilingId)
            .containsExactly(3, 2);
    }

    @Test
    @DisplayName("A second version with the same filing and amendment violates the unique key")
    void rejectsDuplicateAmendment() {
        versionRepository.saveAndFlush(Form460FilingVersionEntity.of(1001, 0, summary(5000)));

        assertThatThrownBy(() -> versionRepository.saveAndFlush(
            Form460FilingVersionEntity.of(1001, 0, summary(9999))))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("A second filing with the same filing id is inserted and fails on the primary key")
    void rejectsSecondFilingWithSameId() {
        Form460FilingEntity first = Form460FilingEntity.of(1001, 0, summary(5000));
        assertThat(first.isNew()).isTrue();
        filingRepository.saveAndFlush(first);
        assertThat(first.isNew()).isFalse();
        entityManager.clear();

        assertThat(filingRepository.findById(1001)).hasValueSatisfying(loaded -> assertThat(loaded.isNew()).isFalse());
        entityManager.clear();

        assertThatThrownBy(() -> filingRepository.saveAndFlush(Form460FilingEntity.of(1001, 3, summary(9999))))
            .isInstanceOf(DataIntegrityViolationException.class);
    }
}

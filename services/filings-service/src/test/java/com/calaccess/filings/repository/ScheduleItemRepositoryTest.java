package com.calaccess.filings.repository;

import com.calaccess.filings.domain.item.MonetaryContribution;
import com.calaccess.filings.domain.item.ScheduleAItemEntity;
import com.calaccess.filings.domain.item.ScheduleAItemVersionEntity;
import com.calaccess.filings.domain.item.ScheduleEItemEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;

import static com.calaccess.filings.Form460Fixtures.contribution;
import static com.calaccess.filings.Form460Fixtures.payment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("Schedule item repositories")
class ScheduleItemRepositoryTest {

    @Autowired
    private ScheduleAItemRepository scheduleARepository;

    @Autowired
    private ScheduleAItemVersionRepository scheduleAVersionRepository;

    @Autowired
    private ScheduleEItemRepository scheduleERepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("Embedded contribution fields survive a round trip")
    void storesEmbeddedFields() {
        ScheduleAItemEntity saved = scheduleARepository.saveAndFlush(
            ScheduleAItemEntity.of(1001, 1, contribution("2500.00")));
        entityManager.clear();

        ScheduleAItemEntity loaded = scheduleARepository.findByFilingIdAndLineItem(1001, 1).orElseThrow();
        MonetaryContribution fields = loaded.getFields();

        assertThat(loaded.getId()).isEqualTo(saved.getId());
        assertThat(fields.amount()).isEqualByComparingTo(new BigDecimal("2500.00"));
        assertThat(fields.contribution().contributor().lastName()).isEqualTo("Doe");
        assertThat(fields.contribution().contributorCode()).isEqualTo("IND");
        assertThat(fields.contribution().cumulativeYtdAmount()).isNull();
    }

    @Test
    @DisplayName("Line items of a filing come back in order and can be replaced")
    void listsAndDeletesItemsOfOneFiling() {
        scheduleARepository.save(ScheduleAItemEntity.of(1001, 2, contribution("20.00")));
        scheduleARepository.save(ScheduleAItemEntity.of(1001, 1, contribution("10.00")));
        scheduleARepository.save(ScheduleAItemEntity.of(2002, 1, contribution("99.00")));
        scheduleARepository.flush();

        assertThat(scheduleARepository.findByFilingIdOrderByLineItemAsc(1001))
            .extracting(ScheduleAItemEntity::getLineItem)
            .containsExactly(1, 2);
        assertThat(scheduleARepository.countByFilingId(1001)).isEqualTo(2);

        assertThat(scheduleARepository.deleteAllOfFiling(1001)).isEqualTo(2);
        assertThat(scheduleARepository.countByFilingId(1001)).isZero();
        assertThat(scheduleARepository.countByFilingId(2002)).isEqualTo(1);
    }

    @Test
    @DisplayName("Detaching orphans items without deleting them")
    void detachesItemsFromFilingAndVersion() {
        ScheduleEItemEntity current = scheduleERepository.saveAndFlush(ScheduleEItemEntity.of(1001, 1, payment("75.00")));
        ScheduleAItemVersionEntity versioned = scheduleAVersionRepository.saveAndFlush(
            ScheduleAItemVersionEntity.of(42L, 1, contribution("10.00")));

        assertThat(scheduleERepository.detachFromFiling(1001)).isEqualTo(1);
        assertThat(scheduleAVersionRepository.detachFromVersion(42L)).isEqualTo(1);

        ScheduleEItemEntity orphanItem = scheduleERepository.findById(current.getId()).orElseThrow();
        assertThat(orphanItem.getFilingId()).isNull();
        assertThat(orphanItem.getFields().amount()).isEqualByComparingTo("75.00");
        assertThat(scheduleAVersionRepository.findById(versioned.getId()).orElseThrow().getFilingVersionId()).isNull();
    }

    @Test
    @DisplayName("The same line item twice on one filing violates the unique key")
    void rejectsDuplicateLineItem() {
        scheduleARepository.saveAndFlush(ScheduleAItemEntity.of(1001, 1, contribution("10.00")));

        assertThatThrownBy(() -> scheduleARepository.saveAndFlush(
            ScheduleAItemEntity.of(1001, 1, contribution("11.00"))))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Items without an amount are rejected by the schema")
    void rejectsMissingAmount() {
        assertThatThrownBy(() -> scheduleARepository.saveAndFlush(
            ScheduleAItemEntity.of(1001, 1, contribution(null))))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("The same line item twice on one version violates the unique key")
    void rejectsDuplicateVersionLineItem() {
        scheduleAVersionRepository.saveAndFlush(ScheduleAItemVersionEntity.of(42L, 1, contribution("10.00")));
        scheduleAVersionRepository.saveAndFlush(ScheduleAItemVersionEntity.of(43L, 1, contribution("10.00")));

        assertThatThrownBy(() -> scheduleAVersionRepository.saveAndFlush(
            ScheduleAItemVersionEntity.of(42L, 1, contribution("12.00"))))
            .isInstanceOf(DataIntegrityViolationException.class);
    }
}

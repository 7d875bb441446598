package com.calaccess.filings.service;

import com.calaccess.filings.domain.item.Schedule;
import com.calaccess.filings.domain.item.ScheduleAItemEntity;
import com.calaccess.filings.domain.item.ScheduleAItemVersionEntity;
import com.calaccess.filings.repository.ScheduleAItemRepository;
import com.calaccess.filings.repository.ScheduleAItemVersionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@DisplayName("ScheduleRegistry")
class ScheduleRegistryTest {

    @Test
    @DisplayName("Fails fast when a schedule has no store")
    void requiresEverySchedule() {
        assertThatThrownBy(() -> new ScheduleRegistry(List.of()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("No store configured for Schedule A");
    }

    @Test
    @DisplayName("Fails fast when a schedule has two stores")
    void rejectsSecondStore() {
        ScheduleStore<?, ?, ?> store = new ScheduleStore<>(
            Schedule.A,
            mock(ScheduleAItemRepository.class),
            mock(ScheduleAItemVersionRepository.class),
            ScheduleAItemEntity::of,
            ScheduleAItemVersionEntity::of
        );

        assertThatThrownBy(() -> new ScheduleRegistry(List.of(store, store)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("More than one store configured for Schedule A");
    }
}

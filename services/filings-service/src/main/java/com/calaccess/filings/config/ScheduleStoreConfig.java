package com.calaccess.filings.config;

import com.calaccess.filings.domain.item.AgentPayment;
import com.calaccess.filings.domain.item.ElectionSupportItem;
import com.calaccess.filings.domain.item.MiscCashIncrease;
import com.calaccess.filings.domain.item.MonetaryContribution;
import com.calaccess.filings.domain.item.NonmonetaryContribution;
import com.calaccess.filings.domain.item.Payment;
import com.calaccess.filings.domain.item.PaymentSubItem;
import com.calaccess.filings.domain.item.Schedule;
import com.calaccess.filings.domain.item.ScheduleAItemEntity;
import com.calaccess.filings.domain.item.ScheduleAItemVersionEntity;
import com.calaccess.filings.domain.item.ScheduleCItemEntity;
import com.calaccess.filings.domain.item.ScheduleCItemVersionEntity;
import com.calaccess.filings.domain.item.ScheduleDItemEntity;
import com.calaccess.filings.domain.item.ScheduleDItemVersionEntity;
import com.calaccess.filings.domain.item.ScheduleEItemEntity;
import com.calaccess.filings.domain.item.ScheduleEItemVersionEntity;
import com.calaccess.filings.domain.item.ScheduleESubItemEntity;
import com.calaccess.filings.domain.item.ScheduleESubItemVersionEntity;
import com.calaccess.filings.domain.item.ScheduleGItemEntity;
import com.calaccess.filings.domain.item.ScheduleGItemVersionEntity;
import com.calaccess.filings.domain.item.ScheduleIItemEntity;
import com.calaccess.filings.domain.item.ScheduleIItemVersionEntity;
import com.calaccess.filings.repository.ScheduleAItemRepository;
import com.calaccess.filings.repository.ScheduleAItemVersionRepository;
import com.calaccess.filings.repository.ScheduleCItemRepository;
import com.calaccess.filings.repository.ScheduleCItemVersionRepository;
import com.calaccess.filings.repository.ScheduleDItemRepository;
import com.calaccess.filings.repository.ScheduleDItemVersionRepository;
import com.calaccess.filings.repository.ScheduleEItemRepository;
import com.calaccess.filings.repository.ScheduleEItemVersionRepository;
import com.calaccess.filings.repository.ScheduleESubItemRepository;
import com.calaccess.filings.repository.ScheduleESubItemVersionRepository;
import com.calaccess.filings.repository.ScheduleGItemRepository;
import com.calaccess.filings.repository.ScheduleGItemVersionRepository;
import com.calaccess.filings.repository.ScheduleIItemRepository;
import com.calaccess.filings.repository.ScheduleIItemVersionRepository;
import com.calaccess.filings.service.ScheduleStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ScheduleStoreConfig {

    @Bean
    ScheduleStore<MonetaryContribution, ScheduleAItemEntity, ScheduleAItemVersionEntity> scheduleAStore(
        ScheduleAItemRepository current, ScheduleAItemVersionRepository versions
    ) {
        return new ScheduleStore<>(Schedule.A, current, versions, ScheduleAItemEntity::of, ScheduleAItemVersionEntity::of);
    }

    @Bean
    ScheduleStore<NonmonetaryContribution, ScheduleCItemEntity, ScheduleCItemVersionEntity> scheduleCStore(
        ScheduleCItemRepository current, ScheduleCItemVersionRepository versions
    ) {
        return new ScheduleStore<>(Schedule.C, current, versions, ScheduleCItemEntity::of, ScheduleCItemVersionEntity::of);
    }

    @Bean
    ScheduleStore<ElectionSupportItem, ScheduleDItemEntity, ScheduleDItemVersionEntity> scheduleDStore(
        ScheduleDItemRepository current, ScheduleDItemVersionRepository versions
    ) {
        return new ScheduleStore<>(Schedule.D, current, versions, ScheduleDItemEntity::of, ScheduleDItemVersionEntity::of);
    }

    @Bean
    ScheduleStore<Payment, ScheduleEItemEntity, ScheduleEItemVersionEntity> scheduleEStore(
        ScheduleEItemRepository current, ScheduleEItemVersionRepository versions
    ) {
        return new ScheduleStore<>(Schedule.E, current, versions, ScheduleEItemEntity::of, ScheduleEItemVersionEntity::of);
    }

    @Bean
    ScheduleStore<PaymentSubItem, ScheduleESubItemEntity, ScheduleESubItemVersionEntity> scheduleESubStore(
        ScheduleESubItemRepository current, ScheduleESubItemVersionRepository versions
    ) {
        return new ScheduleStore<>(
            Schedule.E_SUB, current, versions, ScheduleESubItemEntity::of, ScheduleESubItemVersionEntity::of
        );
    }

    @Bean
    ScheduleStore<AgentPayment, ScheduleGItemEntity, ScheduleGItemVersionEntity> scheduleGStore(
        ScheduleGItemRepository current, ScheduleGItemVersionRepository versions
    ) {
        return new ScheduleStore<>(Schedule.G, current, versions, ScheduleGItemEntity::of, ScheduleGItemVersionEntity::of);
    }

    @Bean
    ScheduleStore<MiscCashIncrease, ScheduleIItemEntity, ScheduleIItemVersionEntity> scheduleIStore(
        ScheduleIItemRepository current, ScheduleIItemVersionRepository versions
    ) {
        return new ScheduleStore<>(Schedule.I, current, versions, ScheduleIItemEntity::of, ScheduleIItemVersionEntity::of);
    }
}

package com.calaccess.filings.service;

import com.calaccess.filings.domain.item.Schedule;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Looks up the {@link ScheduleStore} of each Form 460 schedule.
 */
@Component
public class ScheduleRegistry {

    private final Map<String, ScheduleStore<?, ?, ?>> stores = new HashMap<>();
    private final List<ScheduleStore<?, ?, ?>> ordered = new ArrayList<>();

    public ScheduleRegistry(List<ScheduleStore<?, ?, ?>> stores) {
        for (ScheduleStore<?, ?, ?> store : stores) {
            ScheduleStore<?, ?, ?> previous = this.stores.put(store.schedule().code(), store);
            if (previous != null) {
                throw new IllegalStateException("More than one store configured for " + store.schedule());
            }
        }
        for (Schedule<?> schedule : Schedule.values()) {
            ScheduleStore<?, ?, ?> store = this.stores.get(schedule.code());
            if (store == null) {
                throw new IllegalStateException("No store configured for " + schedule);
            }
            ordered.add(store);
        }
    }

    // in form order
    public List<ScheduleStore<?, ?, ?>> all() {
        return ordered;
    }

    public ScheduleStore<?, ?, ?> forSchedule(Schedule<?> schedule) {
        return stores.get(schedule.code());
    }

    public ScheduleStore<?, ?, ?> forCode(String code) {
        Schedule<?> schedule = Schedule.fromCode(code)
            .orElseThrow(() -> new RecordNotFoundException("Unknown schedule: " + code));
        return forSchedule(schedule);
    }
}

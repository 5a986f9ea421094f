package com.example.cronkeeper.domain.trigger;

import com.example.cronkeeper.domain.entity.Entry;
import com.example.cronkeeper.domain.time.DateTime;
import com.example.cronkeeper.domain.time.Duration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runtime cursor of a work: when it is next due and how often it has fired.
 * <p>
 * Derived once from the entry's trigger and advanced afterwards by the work's
 * {@code start} transition. {@code execTime} is null for {@code Never} timers
 * and for entries without a trigger.
 */
@Slf4j
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerState {

    private DateTime execTime;

    private int execTimes;

    public static TriggerState fromEntry(Entry entry) {
        return fromEntry(entry, DateTime.now());
    }

    public static TriggerState fromEntry(Entry entry, DateTime now) {
        if (!(entry.getTrigger() instanceof Trigger.Timed timed)) {
            return new TriggerState(null, 0);
        }
        var timer = timed.timer();
        if (timer instanceof Timer.Repeat repeat) {
            return new TriggerState(firstDue(entry, now, repeat.every()), 0);
        }
        if (timer instanceof Timer.ManyTimes manyTimes) {
            return new TriggerState(firstDue(entry, now, manyTimes.every()), 0);
        }
        if (timer instanceof Timer.Once once) {
            return new TriggerState(once.at(), 0);
        }
        return new TriggerState(null, 0);
    }

    private static DateTime firstDue(Entry entry, DateTime now, Duration every) {
        return now.plus(every).orElseGet(() -> {
            log.error("Cannot compute first due time of entry {} ({}) from {}", entry.getName(), entry.getId(), every);
            return null;
        });
    }
}

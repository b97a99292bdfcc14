package com.profilescheduler.orchestrator.service;

import com.profilescheduler.orchestrator.model.RecurrencePattern;
import com.profilescheduler.orchestrator.model.Schedule;
import com.profilescheduler.orchestrator.model.ScheduleType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the next fire time of a schedule. Pure, no I/O.
 *
 * Calendar arithmetic happens in the configured zone so "same time of day"
 * and weekday indices mean what the person who created the schedule saw,
 * including across DST changes.
 *
 * Weekday indices: 0 = Sunday … 6 = Saturday.
 *
 * Monthly steps from the previous occurrence, not from the day of month the
 * schedule was created with; only start_time is stored. After a clamp the
 * schedule stays on the clamped day: Jan 31 → Feb 29 → Mar 29 → Apr 29.
 */
@Component
public class RecurrenceCalculator {

    private final ZoneId zone;

    public RecurrenceCalculator(@Value("${profilescheduler.execution.zone:UTC}") ZoneId zone) {
        this.zone = zone;
    }

    public Optional<Instant> next(Schedule schedule) {
        return next(schedule.getStartTime(),
                    schedule.getScheduleType(),
                    schedule.getRecurrencePattern(),
                    schedule.getRecurrenceDays());
    }

    /**
     * @return the next occurrence strictly after lastFire, or empty when the
     *         schedule is one-shot or its pattern has no further occurrence
     */
    public Optional<Instant> next(Instant lastFire, ScheduleType type,
                                  RecurrencePattern pattern, Set<Integer> days) {
        if (type != ScheduleType.RECURRING || pattern == null) {
            return Optional.empty();
        }
        ZonedDateTime t = lastFire.atZone(zone);

        return switch (pattern) {
            case DAILY   -> Optional.of(t.plusDays(1).toInstant());
            case WEEKLY  -> Optional.of(t.plusDays(weeklyOffset(t, days)).toInstant());
            // Short months clamp to their last day; the clamped day sticks.
            case MONTHLY -> Optional.of(t.plusMonths(1).toInstant());
            case NONE, UNRECOGNIZED -> Optional.empty();
        };
    }

    /**
     * Days until the next configured weekday strictly after today's, wrapping
     * into next week. An empty day set means "same day next week".
     */
    static int weeklyOffset(ZonedDateTime t, Set<Integer> days) {
        TreeSet<Integer> sorted = new TreeSet<>();
        if (days != null) {
            days.stream().filter(d -> d != null && d >= 0 && d <= 6).forEach(sorted::add);
        }
        if (sorted.isEmpty()) {
            return 7;
        }
        int current = t.getDayOfWeek().getValue() % 7;   // ISO Monday=1..Sunday=7 → Sunday=0
        Integer later = sorted.higher(current);
        return later != null
                ? later - current
                : 7 - current + sorted.first();
    }
}

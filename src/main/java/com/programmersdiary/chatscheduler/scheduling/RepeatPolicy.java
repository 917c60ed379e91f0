package com.programmersdiary.chatscheduler.scheduling;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;

/**
 * Run-time arithmetic for schedules. Calendar input is interpreted in the zone of the injected clock.
 */
@Component
public class RepeatPolicy {

    private final Clock clock;

    public RepeatPolicy(Clock clock) {
        this.clock = clock;
    }

    /**
     * Next slot strictly after {@code now}, stepping from the previous run time.
     * Missed slots are skipped rather than replayed.
     */
    public static long nextRunAt(long previousRunAt, RepeatInterval interval, long now) {
        long step = interval.seconds();
        long next = previousRunAt + step;
        if (next <= now) {
            next += ((now - next) / step + 1) * step;
        }
        return next;
    }

    public long runAtFromComponents(Integer year, int month, int day, int hour, int minute) {
        return runAtFromComponents(year, month, day, hour, minute, ZonedDateTime.now(clock));
    }

    public long runAtFromComponents(Integer year, int month, int day, int hour, int minute, ZonedDateTime now) {
        int targetYear = year != null ? year : now.getYear();
        ZonedDateTime target;
        try {
            target = ZonedDateTime.of(LocalDateTime.of(targetYear, month, day, hour, minute), now.getZone());
        } catch (DateTimeException e) {
            throw new ScheduleTimeException("Invalid date/time: " + e.getMessage(), e);
        }
        if (!target.isAfter(now)) {
            throw new ScheduleTimeException("Scheduled time must be in the future.");
        }
        return target.toEpochSecond();
    }

    public long nextDailyOccurrence(int hour, int minute) {
        return nextDailyOccurrence(hour, minute, ZonedDateTime.now(clock));
    }

    public long nextDailyOccurrence(int hour, int minute, ZonedDateTime now) {
        ZonedDateTime target;
        try {
            target = now.withHour(hour).withMinute(minute).withSecond(0).withNano(0);
        } catch (DateTimeException e) {
            throw new ScheduleTimeException("Invalid time: " + e.getMessage(), e);
        }
        if (!target.isAfter(now)) {
            target = target.plusDays(1);
        }
        return target.toEpochSecond();
    }
}

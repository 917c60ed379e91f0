package com.programmersdiary.chatscheduler.scheduling;

import com.programmersdiary.chatscheduler.delivery.DeliveryHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Entry point for user commands: validates input, computes run times and writes to the store.
 * Invalid input is rejected with {@link IllegalArgumentException} before anything is persisted.
 */
@Service
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduledJobRepository jobRepository;
    private final RepeatPolicy repeatPolicy;
    private final Clock clock;
    private final int maxMinutes;

    public ScheduleService(ScheduledJobRepository jobRepository,
                           RepeatPolicy repeatPolicy,
                           Clock clock,
                           @Value("${chatscheduler.schedule.max-minutes:10080}") int maxMinutes) {
        this.jobRepository = jobRepository;
        this.repeatPolicy = repeatPolicy;
        this.clock = clock;
        this.maxMinutes = maxMinutes;
    }

    public long create(String channelId, String kind, String content, long runAt,
                       RepeatInterval repeatInterval, String createdBy) {
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("Channel is required");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Content is required");
        }
        var resolvedKind = kind == null || kind.isBlank() ? DeliveryHandlerRegistry.TEXT_KIND : kind.trim();
        var id = jobRepository.create(channelId.trim(), resolvedKind, content, runAt, repeatInterval,
                createdBy, now());
        log.info("Created job {} ({}) for channel {} at {}{}", id, resolvedKind, channelId, Instant.ofEpochSecond(runAt),
                repeatInterval != null ? " repeating every " + repeatInterval.toValue() : "");
        return id;
    }

    public ScheduledJob scheduleIn(String channelId, String kind, String content, int minutes, String createdBy) {
        if (minutes < 1 || minutes > maxMinutes) {
            throw new IllegalArgumentException("Minutes must be between 1 and " + maxMinutes);
        }
        var id = create(channelId, kind, content, now() + minutes * 60L, null, createdBy);
        return get(id);
    }

    public ScheduledJob scheduleAt(String channelId, String kind, String content,
                                   Integer year, int month, int day, int hour, int minute, String createdBy) {
        checkRange("Month", month, 1, 12);
        checkRange("Day", day, 1, 31);
        checkRange("Hour", hour, 0, 23);
        checkRange("Minute", minute, 0, 59);
        var runAt = repeatPolicy.runAtFromComponents(year, month, day, hour, minute);
        var id = create(channelId, kind, content, runAt, null, createdBy);
        return get(id);
    }

    public ScheduledJob scheduleRepeating(String channelId, String kind, String content,
                                          int hour, int minute, RepeatInterval interval, String createdBy) {
        if (interval == null) {
            throw new IllegalArgumentException("Repeat interval is required");
        }
        checkRange("Hour", hour, 0, 23);
        checkRange("Minute", minute, 0, 59);
        var runAt = repeatPolicy.nextDailyOccurrence(hour, minute);
        var id = create(channelId, kind, content, runAt, interval, createdBy);
        return get(id);
    }

    public List<ScheduledJob> list(String channelId, String createdBy, boolean includeNonPending, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be at least 1");
        }
        return jobRepository.list(channelId, createdBy, includeNonPending, limit);
    }

    /**
     * @return whether the job was canceled; the reason for a refusal is deliberately not reported
     */
    public boolean cancel(long id, String requesterId) {
        var canceled = jobRepository.cancel(id, requesterId);
        if (canceled) {
            log.info("Canceled job {}", id);
        }
        return canceled;
    }

    private ScheduledJob get(long id) {
        return jobRepository.findById(id)
                .orElseThrow(() -> new IllegalStateException("Job not found after insert: " + id));
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static void checkRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(field + " must be between " + min + " and " + max);
        }
    }
}

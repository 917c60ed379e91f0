package com.programmersdiary.chatscheduler.scheduling;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Snapshot of one row of the schedule store. Times are epoch seconds.
 */
public record ScheduledJob(
        long id,
        String channelId,
        String kind,
        String content,
        long runAt,
        RepeatInterval repeatInterval,
        String createdBy,
        JobStatus status,
        String error,
        long createdAt,
        Long sentAt) {

    @JsonIgnore
    public boolean isRepeating() {
        return repeatInterval != null;
    }
}

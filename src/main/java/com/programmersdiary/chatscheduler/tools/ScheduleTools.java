package com.programmersdiary.chatscheduler.tools;

import com.programmersdiary.chatscheduler.scheduling.RepeatInterval;
import com.programmersdiary.chatscheduler.scheduling.ScheduleService;
import com.programmersdiary.chatscheduler.scheduling.ScheduledJob;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;

/**
 * Scheduling commands for one chat channel, acting on behalf of one requester.
 */
public class ScheduleTools {

    static final int DEFAULT_LIST_LIMIT = 10;
    static final int MAX_LIST_LIMIT = 20;
    private static final int PREVIEW_LENGTH = 60;
    private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ScheduleService scheduleService;
    private final String channelId;
    private final String requesterId;
    private final ZoneId zone;

    public ScheduleTools(ScheduleService scheduleService, String channelId, String requesterId, ZoneId zone) {
        this.scheduleService = scheduleService;
        this.channelId = channelId;
        this.requesterId = requesterId;
        this.zone = zone;
    }

    @Tool(description = "Schedule a message to be sent to this channel after a number of minutes.")
    public String scheduleIn(
            @ToolParam(description = "Send after this many minutes, at least 1 and at most the configured maximum (a week by default)") int minutes,
            @ToolParam(description = "Text to send, or the query for a non-text mode") String content,
            @ToolParam(description = "Delivery mode, e.g. 'text'. Defaults to text", required = false) String mode) {
        try {
            var job = scheduleService.scheduleIn(channelId, mode, content, minutes, requesterId);
            return "Scheduled (" + job.kind() + ") (id=" + job.id() + ") for " + display(job.runAt()) + ".";
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        }
    }

    @Tool(description = "Schedule a message at a specific local date and time (minute precision). The time must be in the future.")
    public String scheduleAt(
            @ToolParam(description = "Month (1-12)") int month,
            @ToolParam(description = "Day of month (1-31)") int day,
            @ToolParam(description = "Hour (0-23)") int hour,
            @ToolParam(description = "Minute (0-59)") int minute,
            @ToolParam(description = "Text to send, or the query for a non-text mode") String content,
            @ToolParam(description = "Delivery mode, e.g. 'text'. Defaults to text", required = false) String mode) {
        try {
            var job = scheduleService.scheduleAt(channelId, mode, content, null, month, day, hour, minute, requesterId);
            return "Scheduled (" + job.kind() + ") (id=" + job.id() + ") for " + display(job.runAt()) + ".";
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        }
    }

    @Tool(description = "Repeat a message on a fixed interval, starting at the next occurrence of the given local time.")
    public String scheduleRepeat(
            @ToolParam(description = "Start hour (0-23)") int hour,
            @ToolParam(description = "Start minute (0-59)") int minute,
            @ToolParam(description = "Repeat interval: 'minute', 'hour' or 'day'") String interval,
            @ToolParam(description = "Text to send, or the query for a non-text mode") String content,
            @ToolParam(description = "Delivery mode, e.g. 'text'. Defaults to text", required = false) String mode) {
        try {
            var repeat = RepeatInterval.fromString(interval);
            var job = scheduleService.scheduleRepeating(channelId, mode, content, hour, minute, repeat, requesterId);
            return "Scheduled repeat (" + job.kind() + ") (id=" + job.id() + ") starting " + display(job.runAt())
                    + " every " + job.repeatInterval().toValue() + ".";
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        }
    }

    @Tool(description = "List pending scheduled messages in this channel.")
    public String listSchedules(
            @ToolParam(description = "Max items to show (1-20). Defaults to 10", required = false) Integer limit) {
        int effective = limit == null ? DEFAULT_LIST_LIMIT : limit;
        if (effective < 1 || effective > MAX_LIST_LIMIT) {
            return "Limit must be between 1 and " + MAX_LIST_LIMIT;
        }
        var jobs = scheduleService.list(channelId, null, false, effective);
        if (jobs.isEmpty()) {
            return "No pending scheduled messages.";
        }
        return jobs.stream()
                .map(this::line)
                .collect(Collectors.joining("\n"));
    }

    @Tool(description = "Cancel one of your pending scheduled messages by its id.")
    public String cancelSchedule(
            @ToolParam(description = "The schedule id to cancel") long scheduleId) {
        if (scheduleService.cancel(scheduleId, requesterId)) {
            return "Canceled schedule id=" + scheduleId + ".";
        }
        return "Unable to cancel (not found, not pending, or not created by you).";
    }

    private String line(ScheduledJob job) {
        var content = job.content();
        var preview = content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) + "…" : content;
        var repeat = job.isRepeating() ? " repeat=" + job.repeatInterval().toValue() : "";
        return "- " + job.kind() + " id=" + job.id() + " at " + display(job.runAt()) + repeat + ": " + preview;
    }

    private String display(long epochSecond) {
        return DISPLAY_TIME.format(Instant.ofEpochSecond(epochSecond).atZone(zone));
    }
}

package com.programmersdiary.chatscheduler.tools;

import com.programmersdiary.chatscheduler.scheduling.JobStatus;
import com.programmersdiary.chatscheduler.scheduling.RepeatInterval;
import com.programmersdiary.chatscheduler.scheduling.ScheduleService;
import com.programmersdiary.chatscheduler.scheduling.ScheduleTimeException;
import com.programmersdiary.chatscheduler.scheduling.ScheduledJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleToolsTest {

    private static final long RUN_AT = ZonedDateTime.of(2026, 6, 1, 10, 5, 0, 0, ZoneOffset.UTC).toEpochSecond();

    @Mock
    private ScheduleService scheduleService;

    private ScheduleTools tools;

    @BeforeEach
    void setUp() {
        tools = new ScheduleTools(scheduleService, "123", "u1", ZoneOffset.UTC);
    }

    @Test
    @DisplayName("scheduleIn(): confirms kind, id and local run time")
    void scheduleInConfirms() {
        when(scheduleService.scheduleIn("123", null, "hi", 5, "u1")).thenReturn(job(7, "text", "hi", null));

        assertThat(tools.scheduleIn(5, "hi", null)).isEqualTo("Scheduled (text) (id=7) for 2026-06-01 10:05.");
    }

    @Test
    @DisplayName("scheduleAt(): validation errors are returned as the reply")
    void scheduleAtReturnsValidationError() {
        when(scheduleService.scheduleAt("123", "text", "hi", null, 1, 1, 0, 0, "u1"))
                .thenThrow(new ScheduleTimeException("Scheduled time must be in the future."));

        assertThat(tools.scheduleAt(1, 1, 0, 0, "hi", "text")).isEqualTo("Scheduled time must be in the future.");
    }

    @Test
    @DisplayName("scheduleRepeat(): confirms the interval")
    void scheduleRepeatConfirms() {
        when(scheduleService.scheduleRepeating("123", "image_search", "cats", 10, 5, RepeatInterval.HOUR, "u1"))
                .thenReturn(job(8, "image_search", "cats", RepeatInterval.HOUR));

        assertThat(tools.scheduleRepeat(10, 5, "hour", "cats", "image_search"))
                .isEqualTo("Scheduled repeat (image_search) (id=8) starting 2026-06-01 10:05 every hour.");
    }

    @Test
    @DisplayName("scheduleRepeat(): unknown interval is reported without scheduling")
    void scheduleRepeatRejectsUnknownInterval() {
        assertThat(tools.scheduleRepeat(10, 5, "fortnight", "cats", null))
                .isEqualTo("Unsupported repeat interval: fortnight");
        verifyNoInteractions(scheduleService);
    }

    @Test
    @DisplayName("listSchedules(): one line per job with truncated preview")
    void listSchedulesFormatsLines() {
        var longContent = "x".repeat(70);
        when(scheduleService.list("123", null, false, 10)).thenReturn(List.of(
                job(1, "text", "hi", null),
                job(2, "image_search", longContent, RepeatInterval.DAY)));

        var reply = tools.listSchedules(null);

        assertThat(reply.split("\n")).containsExactly(
                "- text id=1 at 2026-06-01 10:05: hi",
                "- image_search id=2 at 2026-06-01 10:05 repeat=day: " + "x".repeat(60) + "…");
    }

    @Test
    @DisplayName("listSchedules(): empty list and bad limits")
    void listSchedulesEdgeCases() {
        when(scheduleService.list("123", null, false, 3)).thenReturn(List.of());

        assertThat(tools.listSchedules(3)).isEqualTo("No pending scheduled messages.");
        assertThat(tools.listSchedules(0)).isEqualTo("Limit must be between 1 and 20");
        assertThat(tools.listSchedules(21)).isEqualTo("Limit must be between 1 and 20");
    }

    @Test
    @DisplayName("cancelSchedule(): success and refusal replies")
    void cancelScheduleReplies() {
        when(scheduleService.cancel(4L, "u1")).thenReturn(true);
        when(scheduleService.cancel(5L, "u1")).thenReturn(false);

        assertThat(tools.cancelSchedule(4L)).isEqualTo("Canceled schedule id=4.");
        assertThat(tools.cancelSchedule(5L))
                .isEqualTo("Unable to cancel (not found, not pending, or not created by you).");
    }

    private static ScheduledJob job(long id, String kind, String content, RepeatInterval repeat) {
        return new ScheduledJob(id, "123", kind, content, RUN_AT, repeat, "u1", JobStatus.PENDING, null, 0L, null);
    }
}

package com.programmersdiary.chatscheduler.tools;

import com.programmersdiary.chatscheduler.scheduling.ScheduleService;
import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

/**
 * Hands a chat model the scheduling tools for the conversation it is answering in.
 */
@Component
public class ScheduleToolsFactory {

    private final ScheduleService scheduleService;
    private final Clock clock;

    public ScheduleToolsFactory(ScheduleService scheduleService, Clock clock) {
        this.scheduleService = scheduleService;
        this.clock = clock;
    }

    public ScheduleTools create(String channelId, String requesterId) {
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("Channel is required");
        }
        return new ScheduleTools(scheduleService, channelId, requesterId, clock.getZone());
    }

    public List<ToolCallback> toolCallbacks(String channelId, String requesterId) {
        return Arrays.asList(ToolCallbacks.from(create(channelId, requesterId)));
    }
}

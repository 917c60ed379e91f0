package com.programmersdiary.chatscheduler.web;

import com.programmersdiary.chatscheduler.scheduling.RepeatInterval;
import com.programmersdiary.chatscheduler.scheduling.ScheduleService;
import com.programmersdiary.chatscheduler.scheduling.ScheduledJob;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private final ScheduleService scheduleService;

    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @PostMapping("/in")
    @ResponseStatus(HttpStatus.CREATED)
    public ScheduledJob scheduleIn(@RequestBody ScheduleInRequest request) {
        return scheduleService.scheduleIn(request.channelId(), request.kind(), request.content(),
                required(request.minutes(), "minutes"), request.createdBy());
    }

    @PostMapping("/at")
    @ResponseStatus(HttpStatus.CREATED)
    public ScheduledJob scheduleAt(@RequestBody ScheduleAtRequest request) {
        return scheduleService.scheduleAt(request.channelId(), request.kind(), request.content(),
                request.year(),
                required(request.month(), "month"),
                required(request.day(), "day"),
                required(request.hour(), "hour"),
                required(request.minute(), "minute"),
                request.createdBy());
    }

    @PostMapping("/repeat")
    @ResponseStatus(HttpStatus.CREATED)
    public ScheduledJob scheduleRepeat(@RequestBody ScheduleRepeatRequest request) {
        return scheduleService.scheduleRepeating(request.channelId(), request.kind(), request.content(),
                required(request.hour(), "hour"),
                required(request.minute(), "minute"),
                RepeatInterval.fromString(request.interval()),
                request.createdBy());
    }

    @GetMapping
    public List<ScheduledJob> list(@RequestParam(required = false) String channelId,
                                   @RequestParam(required = false) String createdBy,
                                   @RequestParam(defaultValue = "false") boolean includeNonPending,
                                   @RequestParam(defaultValue = "20") int limit) {
        return scheduleService.list(channelId, createdBy, includeNonPending, limit);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void cancel(@PathVariable long id, @RequestParam(required = false) String requester) {
        if (!scheduleService.cancel(id, requester)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND);
        }
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    private static int required(Integer value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("Field '" + field + "' is required");
        }
        return value;
    }

    public record ScheduleInRequest(String channelId, String kind, String content, Integer minutes,
                                    String createdBy) {
    }

    public record ScheduleAtRequest(String channelId, String kind, String content, Integer year, Integer month,
                                    Integer day, Integer hour, Integer minute, String createdBy) {
    }

    public record ScheduleRepeatRequest(String channelId, String kind, String content, Integer hour,
                                        Integer minute, String interval, String createdBy) {
    }
}

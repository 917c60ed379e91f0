package com.programmersdiary.chatscheduler.scheduling;

/**
 * A requested date/time is not a real calendar instant or is not in the future.
 * The message is meant to be shown to the requester as is.
 */
public class ScheduleTimeException extends IllegalArgumentException {

    public ScheduleTimeException(String message) {
        super(message);
    }

    public ScheduleTimeException(String message, Throwable cause) {
        super(message, cause);
    }
}

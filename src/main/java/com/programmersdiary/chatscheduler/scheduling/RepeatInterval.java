package com.programmersdiary.chatscheduler.scheduling;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fixed repeat units. A job without an interval runs once.
 */
public enum RepeatInterval {
    MINUTE(60), HOUR(60 * 60), DAY(60 * 60 * 24);

    private final long seconds;

    RepeatInterval(long seconds) {
        this.seconds = seconds;
    }

    public long seconds() {
        return seconds;
    }

    /** Returns {@code null} for a blank value or {@code "none"}. */
    @JsonCreator
    public static RepeatInterval fromString(String value) {
        if (value == null || value.isBlank()) return null;
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "none" -> null;
            case "minute" -> MINUTE;
            case "hour" -> HOUR;
            case "day" -> DAY;
            default -> throw new IllegalArgumentException("Unsupported repeat interval: " + value);
        };
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

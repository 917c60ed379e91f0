package com.programmersdiary.chatscheduler.scheduling;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobStatus {
    PENDING, SENDING, SENT, CANCELED, FAILED;

    @JsonCreator
    public static JobStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job status is required");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "pending" -> PENDING;
            case "sending" -> SENDING;
            case "sent" -> SENT;
            case "canceled" -> CANCELED;
            case "failed" -> FAILED;
            default -> throw new IllegalArgumentException("Unknown job status: " + value);
        };
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.programmersdiary.chatscheduler.delivery;

public class DeliveryException extends RuntimeException {

    public DeliveryException(String message) {
        super(message);
    }

    public static DeliveryException channelNotFound(String channelId) {
        return new DeliveryException("Channel " + channelId + " not found");
    }

    public static DeliveryException unsupportedKind(String kind) {
        return new DeliveryException("Unsupported schedule kind: " + kind);
    }
}

package com.programmersdiary.chatscheduler.delivery;

/**
 * A resolved destination. Implementations throw on failure; the dispatcher records the message.
 */
public interface DeliverySink {

    /**
     * Delivers text, an attachment reference, or both. Either argument may be {@code null}.
     */
    void deliver(String text, String attachment);

    default void deliver(String text) {
        deliver(text, null);
    }
}

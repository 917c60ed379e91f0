package com.programmersdiary.chatscheduler.delivery;

import com.programmersdiary.chatscheduler.scheduling.ScheduledJobRepository;

/**
 * Delivery behavior for one job kind. Registered as a Spring bean whose name is the kind.
 * Invoked at most once per claimed attempt with the job's raw content; anything thrown
 * fails the job with the exception's message.
 */
@FunctionalInterface
public interface DeliveryHandler {

    void deliver(DeliverySink sink, ScheduledJobRepository store, String content) throws Exception;
}

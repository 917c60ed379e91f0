package com.programmersdiary.chatscheduler.scheduling;

import com.programmersdiary.chatscheduler.delivery.ChannelResolver;
import com.programmersdiary.chatscheduler.delivery.DeliveryException;
import com.programmersdiary.chatscheduler.delivery.DeliveryHandlerRegistry;
import com.programmersdiary.chatscheduler.delivery.DeliverySink;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the store for due jobs and delivers them. Each tick claims one batch and processes it
 * sequentially in run-time order. Anything thrown while resolving or delivering a job, errors
 * included, is recorded on that job and never stops the batch. A failing store fails the tick,
 * and the next tick starts over.
 */
@Component
public class ScheduledJobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobDispatcher.class);
    private static final DateTimeFormatter ANNOUNCE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ScheduledJobRepository jobRepository;
    private final ChannelResolver channelResolver;
    private final DeliveryHandlerRegistry handlerRegistry;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final boolean enabled;
    private final Duration pollInterval;
    private final int batchSize;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> loop;

    public ScheduledJobDispatcher(ScheduledJobRepository jobRepository,
                                  ChannelResolver channelResolver,
                                  DeliveryHandlerRegistry handlerRegistry,
                                  TaskScheduler taskScheduler,
                                  Clock clock,
                                  @Value("${chatscheduler.scheduler.enabled:true}") boolean enabled,
                                  @Value("${chatscheduler.scheduler.poll-interval-seconds:5}") long pollIntervalSeconds,
                                  @Value("${chatscheduler.scheduler.batch-size:10}") int batchSize) {
        if (pollIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Poll interval must be positive: " + pollIntervalSeconds);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.jobRepository = jobRepository;
        this.channelResolver = channelResolver;
        this.handlerRegistry = handlerRegistry;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.enabled = enabled;
        this.pollInterval = Duration.ofSeconds(pollIntervalSeconds);
        this.batchSize = batchSize;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!enabled) {
            log.info("Schedule dispatcher disabled");
            return;
        }
        if (loop != null && !loop.isDone()) return;
        stopped.set(false);
        loop = taskScheduler.scheduleWithFixedDelay(this::tick, pollInterval);
        log.info("Schedule dispatcher started: pollInterval={}, batchSize={}", pollInterval, batchSize);
    }

    /**
     * Stops polling. A tick already running is allowed to finish.
     */
    @PreDestroy
    public void stop() {
        stopped.set(true);
        var current = loop;
        if (current != null) {
            current.cancel(false);
            log.info("Schedule dispatcher stopped");
        }
    }

    void tick() {
        if (stopped.get()) return;
        try {
            dispatchDue(clock.instant().getEpochSecond());
        } catch (RuntimeException e) {
            log.error("Schedule dispatch tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs one tick at {@code now} (epoch seconds).
     *
     * @return number of jobs sent or rescheduled; failed jobs are not counted
     */
    public int dispatchDue(long now) {
        var claimed = jobRepository.claimDue(now, batchSize);
        if (claimed.isEmpty()) {
            return 0;
        }
        log.debug("Claimed {} due job(s)", claimed.size());
        int delivered = 0;
        for (var job : claimed) {
            if (dispatch(job, now)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean dispatch(ScheduledJob job, long now) {
        DeliverySink sink;
        try {
            sink = deliver(job);
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            fail(job, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return false;
        }

        if (!job.isRepeating()) {
            jobRepository.markSent(job.id(), now);
            log.info("Job {} ({}) sent to channel {}", job.id(), job.kind(), job.channelId());
            return true;
        }

        long nextRunAt = RepeatPolicy.nextRunAt(job.runAt(), job.repeatInterval(), now);
        jobRepository.rescheduleRepeat(job.id(), now, nextRunAt);
        log.info("Job {} ({}) sent to channel {}, next run at {}",
                job.id(), job.kind(), job.channelId(), Instant.ofEpochSecond(nextRunAt));
        announce(job, sink, now, nextRunAt);
        return true;
    }

    /**
     * Resolves the destination and handler and runs the delivery.
     *
     * @return the sink the job was delivered to
     */
    private DeliverySink deliver(ScheduledJob job) throws Exception {
        var sink = channelResolver.resolve(job.channelId())
                .orElseThrow(() -> DeliveryException.channelNotFound(job.channelId()));
        var handler = handlerRegistry.find(job.kind())
                .orElseThrow(() -> DeliveryException.unsupportedKind(job.kind()));
        handler.deliver(sink, jobRepository, job.content());
        return sink;
    }

    private void announce(ScheduledJob job, DeliverySink sink, long sentAt, long nextRunAt) {
        try {
            sink.deliver("Sent at " + format(sentAt) + ". Next at " + format(nextRunAt) + ".");
        } catch (RuntimeException e) {
            log.warn("Job {} rescheduled but announcement failed: {}", job.id(), e.getMessage());
        }
    }

    private void fail(ScheduledJob job, String error) {
        jobRepository.markFailed(job.id(), error);
        log.warn("Job {} ({}) failed: {}", job.id(), job.kind(), error);
    }

    private String format(long epochSecond) {
        return ANNOUNCE_TIME.format(Instant.ofEpochSecond(epochSecond).atZone(clock.getZone()));
    }
}

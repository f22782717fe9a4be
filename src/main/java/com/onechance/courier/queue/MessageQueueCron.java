package com.onechance.courier.queue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * MessageQueue poll cron job.
 * <p>Requests a processing pass on a fixed interval while online and idle.
 * <br>Picks up retrying messages whose backoff elapsed and anything a skipped request left behind.
 */
public class MessageQueueCron implements Closeable {
    private static final Logger log = LogManager.getLogger(MessageQueueCron.class);

    private final MessageQueue queue;
    private final Duration period;

    private ScheduledExecutorService scheduler;

    // Timing info (epoch seconds).
    private volatile long lastExecutionEpochSeconds = 0L;
    private volatile long nextExecutionEpochSeconds = 0L;

    /**
     * Constructs a new MessageQueueCron instance.
     *
     * @param queue  MessageQueue instance.
     * @param period Poll interval.
     */
    public MessageQueueCron(MessageQueue queue, Duration period) {
        this.queue = queue;
        this.period = period;
    }

    /**
     * Starts the cron job.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return; // Already running.
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "courier-queue-cron");
            thread.setDaemon(true);
            return thread;
        });

        Runnable task = () -> {
            try {
                tick();
            } catch (Exception e) {
                log.error("MessageQueueCron task error: {}", e.getMessage());
            }
        };

        nextExecutionEpochSeconds = Instant.now().plus(period).getEpochSecond();
        scheduler.scheduleAtFixedRate(task, period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        log.info("MessageQueueCron scheduled: periodMillis={}", period.toMillis());
    }

    /**
     * One scheduled execution.
     */
    void tick() {
        long now = Instant.now().getEpochSecond();
        lastExecutionEpochSeconds = now;
        nextExecutionEpochSeconds = now + Math.max(1L, period.getSeconds());

        if (!queue.isOnline() || queue.isProcessing()) {
            log.trace("Skipping poll: online={}, processing={}", queue.isOnline(), queue.isProcessing());
            return;
        }
        queue.processQueue();
    }

    /** Get last execution time (epoch seconds). */
    public long getLastExecutionEpochSeconds() {
        return lastExecutionEpochSeconds;
    }

    /** Get next scheduled execution time (epoch seconds). */
    public long getNextExecutionEpochSeconds() {
        return nextExecutionEpochSeconds;
    }

    public Duration getPeriod() {
        return period;
    }

    /**
     * Stops the cron job.
     */
    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.debug("MessageQueueCron stopped");
        }
    }
}

package com.onechance.courier.queue;

import com.onechance.courier.config.server.QueueConfig;
import com.onechance.courier.network.Connectivity;
import com.onechance.courier.queue.payload.MessagePayload;
import com.onechance.courier.sender.ChannelSenders;
import com.onechance.courier.sender.DeliveryException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MessageDispatcher runs processing passes over the queue.
 * <p>This class is responsible for:
 * <ul>
 *   <li>Selecting eligible messages in priority then age order fixed at pass start</li>
 *   <li>Stopping the pass as soon as connectivity is lost</li>
 *   <li>Attempting delivery one message at a time with a throttle between attempts</li>
 *   <li>Sending to each recipient not yet delivered, under a per send timeout</li>
 *   <li>Recording the outcome so the queue can apply the retry ladder</li>
 * </ul>
 * <p>Only one pass runs at a time, overlapping requests return immediately.
 */
class MessageDispatcher {
    private static final Logger log = LogManager.getLogger(MessageDispatcher.class);

    private final MessageQueue queue;
    private final ChannelSenders senders;
    private final Connectivity connectivity;
    private final Clock clock;
    private final Duration attemptDelay;
    private final Duration sendTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService senderExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "courier-sender");
        thread.setDaemon(true);
        return thread;
    });

    /**
     * Constructs a MessageDispatcher for the given queue.
     *
     * @param queue        MessageQueue instance.
     * @param senders      ChannelSenders instance.
     * @param connectivity Connectivity signal.
     * @param config       QueueConfig instance.
     * @param clock        Clock instance.
     */
    MessageDispatcher(MessageQueue queue, ChannelSenders senders, Connectivity connectivity, QueueConfig config, Clock clock) {
        this.queue = queue;
        this.senders = senders;
        this.connectivity = connectivity;
        this.clock = clock;
        this.attemptDelay = config.getAttemptDelay();
        this.sendTimeout = config.getSendTimeout();
    }

    /**
     * Runs one processing pass.
     */
    void runPass() {
        if (!running.compareAndSet(false, true)) {
            log.trace("Pass already running");
            return;
        }

        try {
            if (!connectivity.isOnline()) {
                log.debug("Offline, skipping pass");
                return;
            }

            List<QueuedMessage> eligible = queue.selectEligible(clock.instant());
            if (eligible.isEmpty()) {
                log.trace("No eligible messages");
                return;
            }

            queue.setProcessing(true);
            log.info("Processing {} messages from queue", eligible.size());

            for (int i = 0; i < eligible.size(); i++) {
                if (i > 0 && !throttle()) {
                    break;
                }
                if (!connectivity.isOnline()) {
                    log.info("Network lost during processing, stopping pass: remaining={}", eligible.size() - i);
                    break;
                }
                processMessage(eligible.get(i).getId());
            }
        } catch (RuntimeException e) {
            log.error("Processing pass error: {}", e.getMessage(), e);
        } finally {
            queue.setProcessing(false);
            running.set(false);
        }
    }

    /**
     * Attempts delivery of one message.
     *
     * @param id Message id.
     */
    void processMessage(String id) {
        QueuedMessage message = queue.beginAttempt(id, clock.instant());
        if (message == null) {
            log.debug("Message no longer eligible, skipping: id={}", id);
            return;
        }

        List<String> recipients = message.getRemainingRecipients();
        log.info("Attempting {} message: id={}, attempt={}/{}, recipients={}, alreadyDelivered={}",
                message.getChannel().getKey(), id, message.getAttempts(), message.getMaxAttempts(),
                recipients.size(), message.getDeliveredRecipients().size());

        String error = null;
        for (String recipient : recipients) {
            try {
                deliver(recipient, message.getPayload());
                queue.recordDelivered(id, recipient);
            } catch (DeliveryException e) {
                error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("Delivery failed: id={}, recipient={}, error={}", id, recipient, error);
                break;
            }
        }

        QueuedMessage result = queue.completeAttempt(id, error, clock.instant());
        if (result == null) {
            log.info("Message removed during send: id={}", id);
            return;
        }

        if (result.getStatus() == MessageStatus.SENT) {
            log.info("Successfully sent {} message: id={}", result.getChannel().getKey(), id);
        } else if (result.getStatus() == MessageStatus.FAILED) {
            log.warn("Message failed permanently after {} attempts: id={}", result.getAttempts(), id);
        } else {
            log.info("Will retry {} message at {}: id={}", result.getChannel().getKey(), result.getNextRetryAt(), id);
        }
        queue.fireAttemptCompleted(result, error == null);
    }

    /**
     * Sends to one recipient under the send timeout.
     *
     * @param recipient Recipient.
     * @param payload   Payload.
     * @throws DeliveryException On failure or timeout.
     */
    void deliver(String recipient, MessagePayload payload) throws DeliveryException {
        Future<Object> future = senderExecutor.submit(() -> {
            senders.send(recipient, payload);
            return null;
        });

        try {
            future.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DeliveryException("Send timed out after " + describe(sendTimeout));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DeliveryException) {
                throw (DeliveryException) cause;
            }
            throw new DeliveryException("Unexpected sender error: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DeliveryException("Interrupted during send", e);
        }
    }

    /**
     * Waits between two attempts.
     *
     * @return False if interrupted.
     */
    private boolean throttle() {
        if (attemptDelay.isZero() || attemptDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(attemptDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Pass interrupted");
            return false;
        }
    }

    static String describe(Duration duration) {
        long millis = duration.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }

    void close() {
        senderExecutor.shutdownNow();
    }
}

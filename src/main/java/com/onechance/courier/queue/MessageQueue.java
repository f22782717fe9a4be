package com.onechance.courier.queue;

import com.onechance.courier.config.server.QueueConfig;
import com.onechance.courier.network.Connectivity;
import com.onechance.courier.network.ConnectivityListener;
import com.onechance.courier.queue.payload.MessagePayload;
import com.onechance.courier.queue.store.QueueStore;
import com.onechance.courier.sender.ChannelSenders;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Outbound message queue.
 * <p>Owns the in-memory list of queued messages and writes it through to a {@link QueueStore} after every change.
 * <br>All mutations are serialized behind a single lock.
 * <p>Processing passes run on the dispatch executor so callers never block on delivery.
 * <br>A pass is requested after enqueue and retry, by {@link MessageQueueCron} and when connectivity comes back.
 * <p>Expected outcomes are reported through return values, never exceptions.
 *
 * @see MessageDispatcher
 */
public class MessageQueue implements Closeable {
    private static final Logger log = LogManager.getLogger(MessageQueue.class);

    /**
     * Dispatch order, priority descending then oldest first.
     */
    static final Comparator<QueuedMessage> DISPATCH_ORDER = Comparator
            .comparingInt((QueuedMessage m) -> m.getPriority().getRank()).reversed()
            .thenComparing(QueuedMessage::getCreatedAt);

    private final QueueStore store;
    private final Connectivity connectivity;
    private final QueueConfig config;
    private final Clock clock;
    private final Executor dispatchExecutor;
    private final boolean ownsExecutor;
    private final MessageDispatcher dispatcher;
    private final ConnectivityListener connectivityListener = this::onConnectivityChanged;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<QueuedMessage> messages = new ArrayList<>();
    private final List<QueueListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean passRequested = new AtomicBoolean(false);
    private volatile boolean processing = false;
    private volatile boolean closed = false;

    /**
     * Constructs a new MessageQueue instance with its own dispatcher thread.
     *
     * @param store        QueueStore instance.
     * @param senders      ChannelSenders instance.
     * @param connectivity Connectivity signal.
     * @param config       QueueConfig instance.
     */
    public MessageQueue(QueueStore store, ChannelSenders senders, Connectivity connectivity, QueueConfig config) {
        this(store, senders, connectivity, config, Clock.systemUTC(), Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "courier-dispatcher");
            thread.setDaemon(true);
            return thread;
        }), true);
    }

    /**
     * Constructs a new MessageQueue instance with given clock and dispatch executor.
     *
     * @param store            QueueStore instance.
     * @param senders          ChannelSenders instance.
     * @param connectivity     Connectivity signal.
     * @param config           QueueConfig instance.
     * @param clock            Clock for timestamps and eligibility.
     * @param dispatchExecutor Executor running processing passes.
     */
    public MessageQueue(QueueStore store, ChannelSenders senders, Connectivity connectivity, QueueConfig config,
                        Clock clock, Executor dispatchExecutor) {
        this(store, senders, connectivity, config, clock, dispatchExecutor, false);
    }

    private MessageQueue(QueueStore store, ChannelSenders senders, Connectivity connectivity, QueueConfig config,
                         Clock clock, Executor dispatchExecutor, boolean ownsExecutor) {
        this.store = store;
        this.connectivity = connectivity;
        this.config = config;
        this.clock = clock;
        this.dispatchExecutor = dispatchExecutor;
        this.ownsExecutor = ownsExecutor;
        this.dispatcher = new MessageDispatcher(this, senders, connectivity, config, clock);

        load();
        connectivity.addListener(connectivityListener);
    }

    /**
     * Loads persisted messages.
     * <p>Messages persisted while SENDING were interrupted by a shutdown and are rescheduled or failed.
     */
    private void load() {
        List<QueuedMessage> loaded = store.load();
        Instant now = clock.instant();
        int recovered = 0;

        lock.lock();
        try {
            for (QueuedMessage message : loaded) {
                if (message.getStatus() == MessageStatus.SENDING) {
                    message.recoverInterrupted(now);
                    recovered++;
                    log.warn("Recovered interrupted message: id={}, status={}, attempts={}/{}",
                            message.getId(), message.getStatus().getKey(), message.getAttempts(), message.getMaxAttempts());
                }
                messages.add(message);
            }
            if (recovered > 0) {
                persist();
            }
        } finally {
            lock.unlock();
        }

        log.info("Message queue loaded: messages={}, recovered={}", loaded.size(), recovered);
    }

    /**
     * Enqueues a message with medium priority.
     *
     * @param channel Channel.
     * @param payload Payload matching the channel.
     * @return Message id.
     * @throws IllegalArgumentException When the payload does not match the channel.
     */
    public String enqueue(Channel channel, MessagePayload payload) {
        return enqueue(channel, payload, MessagePriority.MEDIUM);
    }

    /**
     * Enqueues a message.
     * <p>Requests a processing pass when online.
     *
     * @param channel  Channel.
     * @param payload  Payload matching the channel.
     * @param priority Priority, null means medium.
     * @return Message id.
     * @throws IllegalArgumentException When the payload does not match the channel.
     */
    public String enqueue(Channel channel, MessagePayload payload, MessagePriority priority) {
        if (channel == null) {
            throw new IllegalArgumentException("Channel is required");
        }
        if (!channel.getPayloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Payload does not match channel " + channel.getKey());
        }

        QueuedMessage message = QueuedMessage.create(channel, payload,
                priority != null ? priority : MessagePriority.MEDIUM, config.getMaxAttempts(), clock.instant());

        List<QueuedMessage> snapshot;
        lock.lock();
        try {
            messages.add(message);
            snapshot = persist();
        } finally {
            lock.unlock();
        }

        log.info("Enqueued {} message: id={}, priority={}, recipients={}",
                channel.getKey(), message.getId(), message.getPriority(), payload.to().size());
        fireQueueChanged(snapshot);
        processQueue();
        return message.getId();
    }

    /**
     * Removes a message regardless of status.
     *
     * @param id Message id.
     * @return True if a message existed.
     */
    public boolean remove(String id) {
        List<QueuedMessage> snapshot = null;
        lock.lock();
        try {
            if (messages.removeIf(m -> m.getId().equals(id))) {
                snapshot = persist();
            }
        } finally {
            lock.unlock();
        }

        if (snapshot == null) {
            return false;
        }
        log.info("Removed message: id={}", id);
        fireQueueChanged(snapshot);
        return true;
    }

    /**
     * Manually retries a failed or retrying message.
     * <p>Resets attempts, error and schedule, keeping recipients already delivered.
     * <br>Requests a processing pass when online.
     *
     * @param id Message id.
     * @return False if absent or not in FAILED or RETRYING status.
     */
    public boolean retryMessage(String id) {
        List<QueuedMessage> snapshot;
        lock.lock();
        try {
            QueuedMessage message = find(id);
            if (message == null || (message.getStatus() != MessageStatus.FAILED && message.getStatus() != MessageStatus.RETRYING)) {
                return false;
            }
            message.resetForRetry();
            snapshot = persist();
        } finally {
            lock.unlock();
        }

        log.info("Manual retry: id={}", id);
        fireQueueChanged(snapshot);
        processQueue();
        return true;
    }

    /**
     * Removes all sent messages.
     *
     * @return Count removed.
     */
    public int clearSentMessages() {
        return clearByStatus(MessageStatus.SENT);
    }

    /**
     * Removes all failed messages.
     *
     * @return Count removed.
     */
    public int clearFailedMessages() {
        return clearByStatus(MessageStatus.FAILED);
    }

    private int clearByStatus(MessageStatus status) {
        int removed = 0;
        List<QueuedMessage> snapshot = null;
        lock.lock();
        try {
            Iterator<QueuedMessage> iterator = messages.iterator();
            while (iterator.hasNext()) {
                if (iterator.next().getStatus() == status) {
                    iterator.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                snapshot = persist();
            }
        } finally {
            lock.unlock();
        }

        if (snapshot != null) {
            log.info("Cleared {} {} messages", removed, status.getKey());
            fireQueueChanged(snapshot);
        }
        return removed;
    }

    /**
     * Gets counts by status.
     *
     * @return QueueStats instance.
     */
    public QueueStats getStats() {
        lock.lock();
        try {
            return QueueStats.of(messages);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets a snapshot of all messages in store order.
     *
     * @return List of copies.
     */
    public List<QueuedMessage> getQueue() {
        lock.lock();
        try {
            return copies();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets one message.
     *
     * @param id Message id.
     * @return Optional copy.
     */
    public Optional<QueuedMessage> getMessage(String id) {
        lock.lock();
        try {
            QueuedMessage message = find(id);
            return message != null ? Optional.of(new QueuedMessage(message)) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks if a processing pass is running.
     *
     * @return Boolean.
     */
    public boolean isProcessing() {
        return processing;
    }

    /**
     * Checks connectivity.
     *
     * @return Boolean.
     */
    public boolean isOnline() {
        return connectivity.isOnline();
    }

    public void addListener(QueueListener listener) {
        listeners.add(listener);
    }

    public void removeListener(QueueListener listener) {
        listeners.remove(listener);
    }

    /**
     * Requests a processing pass.
     * <p>Ignored when offline or closed. A pass already running absorbs the request.
     * <br>Requests made before a queued pass starts collapse into that pass.
     */
    public void processQueue() {
        if (closed) {
            return;
        }
        if (!connectivity.isOnline()) {
            log.trace("Offline, pass not requested");
            return;
        }

        if (!passRequested.compareAndSet(false, true)) {
            log.trace("Pass already requested");
            return;
        }
        try {
            dispatchExecutor.execute(() -> {
                passRequested.set(false);
                dispatcher.runPass();
            });
        } catch (RejectedExecutionException e) {
            passRequested.set(false);
            log.debug("Pass request rejected: {}", e.getMessage());
        }
    }

    private void onConnectivityChanged(boolean online) {
        fire(listener -> listener.onOnlineChanged(online));
        if (online) {
            log.info("Back online, processing queue");
            processQueue();
        }
    }

    /**
     * Selects messages eligible for an attempt in dispatch order.
     *
     * @param now Current time.
     * @return List of copies.
     */
    List<QueuedMessage> selectEligible(Instant now) {
        lock.lock();
        try {
            List<QueuedMessage> eligible = new ArrayList<>();
            for (QueuedMessage message : messages) {
                if (message.isEligible(now)) {
                    eligible.add(new QueuedMessage(message));
                }
            }
            eligible.sort(DISPATCH_ORDER);
            return eligible;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves a message to SENDING if it is still present and eligible.
     *
     * @param id  Message id.
     * @param now Attempt time.
     * @return Copy after the change or null when skipped.
     */
    QueuedMessage beginAttempt(String id, Instant now) {
        QueuedMessage result;
        List<QueuedMessage> snapshot;
        lock.lock();
        try {
            QueuedMessage message = find(id);
            if (message == null || !message.isEligible(now)) {
                return null;
            }
            message.markSending(now);
            result = new QueuedMessage(message);
            snapshot = persist();
        } finally {
            lock.unlock();
        }

        fireQueueChanged(snapshot);
        return result;
    }

    /**
     * Records one recipient as delivered.
     *
     * @param id        Message id.
     * @param recipient Recipient.
     */
    void recordDelivered(String id, String recipient) {
        lock.lock();
        try {
            QueuedMessage message = find(id);
            if (message != null) {
                message.recordDelivered(recipient);
                persist();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Completes an attempt.
     *
     * @param id    Message id.
     * @param error Failure reason or null on success.
     * @param now   Completion time.
     * @return Copy after the change or null when the message was removed meanwhile.
     */
    QueuedMessage completeAttempt(String id, String error, Instant now) {
        QueuedMessage result;
        List<QueuedMessage> snapshot;
        lock.lock();
        try {
            QueuedMessage message = find(id);
            if (message == null) {
                return null;
            }
            if (error == null) {
                message.markSent();
            } else {
                message.markFailed(error, now);
            }
            result = new QueuedMessage(message);
            snapshot = persist();
        } finally {
            lock.unlock();
        }

        fireQueueChanged(snapshot);
        return result;
    }

    void setProcessing(boolean value) {
        if (processing != value) {
            processing = value;
            fire(listener -> listener.onProcessingChanged(value));
        }
    }

    void fireAttemptCompleted(QueuedMessage message, boolean success) {
        fire(listener -> listener.onAttemptCompleted(message, success));
    }

    private void fireQueueChanged(List<QueuedMessage> snapshot) {
        fire(listener -> listener.onQueueChanged(snapshot));
    }

    private void fire(Consumer<QueueListener> event) {
        for (QueueListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.error("Queue listener error: {}", e.getMessage());
            }
        }
    }

    /**
     * Saves current state. Caller must hold the lock.
     *
     * @return Snapshot that was saved.
     */
    private List<QueuedMessage> persist() {
        List<QueuedMessage> snapshot = copies();
        store.save(snapshot);
        return snapshot;
    }

    private List<QueuedMessage> copies() {
        List<QueuedMessage> copies = new ArrayList<>(messages.size());
        for (QueuedMessage message : messages) {
            copies.add(new QueuedMessage(message));
        }
        return copies;
    }

    private QueuedMessage find(String id) {
        for (QueuedMessage message : messages) {
            if (message.getId().equals(id)) {
                return message;
            }
        }
        return null;
    }

    /**
     * Stops processing.
     * <p>The store is left open for its owner to close.
     */
    @Override
    public void close() {
        closed = true;
        connectivity.removeListener(connectivityListener);
        dispatcher.close();
        if (ownsExecutor && dispatchExecutor instanceof ExecutorService) {
            ExecutorService executor = (ExecutorService) dispatchExecutor;
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Message queue closed");
    }
}

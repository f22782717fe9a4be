package com.onechance.courier.queue;

import com.onechance.courier.queue.payload.MessagePayload;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Unit of outbound work.
 * <p>Identity, channel, priority and payload never change after creation.
 * <br>Status and scheduling fields are mutated only by {@link MessageQueue} under its lock.
 * <br>Instances handed out of the queue are copies and changing them has no effect.
 */
public class QueuedMessage {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private String id;
    private Channel channel;
    private MessageStatus status;
    private MessagePriority priority;
    private MessagePayload payload;
    private Instant createdAt;
    private Instant lastAttemptAt;
    private Instant nextRetryAt;
    private int attempts;
    private int maxAttempts;
    private String lastError;
    private Set<String> deliveredRecipients = new LinkedHashSet<>();

    /**
     * Constructs a new QueuedMessage instance.
     * <p>Used by the JSON reader.
     */
    QueuedMessage() {
    }

    /**
     * Copy constructor.
     *
     * @param source Message to copy.
     */
    public QueuedMessage(QueuedMessage source) {
        this.id = source.id;
        this.channel = source.channel;
        this.status = source.status;
        this.priority = source.priority;
        this.payload = source.payload;
        this.createdAt = source.createdAt;
        this.lastAttemptAt = source.lastAttemptAt;
        this.nextRetryAt = source.nextRetryAt;
        this.attempts = source.attempts;
        this.maxAttempts = source.maxAttempts;
        this.lastError = source.lastError;
        this.deliveredRecipients = new LinkedHashSet<>(source.getDeliveredRecipients());
    }

    /**
     * Creates a new pending message.
     *
     * @param channel     Channel.
     * @param payload     Payload matching the channel.
     * @param priority    Priority.
     * @param maxAttempts Attempt bound.
     * @param now         Creation time.
     * @return QueuedMessage instance.
     */
    public static QueuedMessage create(Channel channel, MessagePayload payload, MessagePriority priority, int maxAttempts, Instant now) {
        QueuedMessage message = new QueuedMessage();
        message.id = newId(channel, now);
        message.channel = channel;
        message.status = MessageStatus.PENDING;
        message.priority = priority;
        message.payload = payload;
        message.createdAt = now;
        message.attempts = 0;
        message.maxAttempts = maxAttempts;
        return message;
    }

    /**
     * Generates a message id.
     * <p>Format: {@code <channel>_<epochMillis>_<9 random base36 chars>}.
     *
     * @param channel Channel.
     * @param now     Creation time.
     * @return Id string.
     */
    static String newId(Channel channel, Instant now) {
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ID_ALPHABET.charAt(RANDOM.nextInt(ID_ALPHABET.length())));
        }
        return channel.getKey() + "_" + now.toEpochMilli() + "_" + suffix;
    }

    public String getId() {
        return id;
    }

    public Channel getChannel() {
        return channel;
    }

    public MessageStatus getStatus() {
        return status;
    }

    public MessagePriority getPriority() {
        return priority;
    }

    public MessagePayload getPayload() {
        return payload;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAttemptAt() {
        return lastAttemptAt;
    }

    public Instant getNextRetryAt() {
        return nextRetryAt;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public String getLastError() {
        return lastError;
    }

    /**
     * Gets recipients already delivered by earlier attempts.
     *
     * @return Unmodifiable set.
     */
    public Set<String> getDeliveredRecipients() {
        return deliveredRecipients != null ? Collections.unmodifiableSet(deliveredRecipients) : Collections.emptySet();
    }

    /**
     * Gets recipients still awaiting delivery, in payload order.
     *
     * @return List of recipients.
     */
    public List<String> getRemainingRecipients() {
        Set<String> delivered = getDeliveredRecipients();
        return payload.to().stream()
                .filter(recipient -> !delivered.contains(recipient))
                .collect(Collectors.toList());
    }

    /**
     * Checks if the message may be attempted now.
     * <p>Pending messages always are, retrying ones once {@code nextRetryAt} has elapsed.
     *
     * @param now Current time.
     * @return Boolean.
     */
    public boolean isEligible(Instant now) {
        if (status == MessageStatus.PENDING) {
            return true;
        }
        return status == MessageStatus.RETRYING && nextRetryAt != null && !nextRetryAt.isAfter(now);
    }

    void markSending(Instant now) {
        status = MessageStatus.SENDING;
        lastAttemptAt = now;
        nextRetryAt = null;
        attempts++;
    }

    void markSent() {
        status = MessageStatus.SENT;
        lastError = null;
        nextRetryAt = null;
    }

    /**
     * Records a failed attempt.
     * <p>Moves to FAILED once attempts are exhausted, otherwise to RETRYING on the backoff ladder.
     *
     * @param error Failure reason.
     * @param now   Failure time.
     */
    void markFailed(String error, Instant now) {
        lastError = error;
        if (attempts >= maxAttempts) {
            status = MessageStatus.FAILED;
            nextRetryAt = null;
        } else {
            status = MessageStatus.RETRYING;
            nextRetryAt = now.plus(RetryScheduler.getRetryDelay(attempts));
        }
    }

    void recordDelivered(String recipient) {
        if (deliveredRecipients == null) {
            deliveredRecipients = new LinkedHashSet<>();
        }
        deliveredRecipients.add(recipient);
    }

    void resetForRetry() {
        status = MessageStatus.PENDING;
        attempts = 0;
        lastError = null;
        nextRetryAt = null;
    }

    /**
     * Recovers a message found in SENDING state at startup.
     *
     * @param now Recovery time.
     */
    void recoverInterrupted(Instant now) {
        lastError = "Interrupted during send";
        if (attempts >= maxAttempts) {
            status = MessageStatus.FAILED;
            nextRetryAt = null;
        } else {
            status = MessageStatus.RETRYING;
            nextRetryAt = now;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueuedMessage)) return false;
        return Objects.equals(id, ((QueuedMessage) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "QueuedMessage{id=" + id +
                ", channel=" + channel +
                ", status=" + status +
                ", priority=" + priority +
                ", attempts=" + attempts + "/" + maxAttempts +
                (lastError != null ? ", lastError=" + lastError : "") +
                "}";
    }
}

package com.onechance.courier.metrics;

import com.onechance.courier.queue.MessageQueue;
import com.onechance.courier.queue.MessageStatus;
import com.onechance.courier.queue.QueueListener;
import com.onechance.courier.queue.QueueStats;
import com.onechance.courier.queue.QueuedMessage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer bindings for queue state.
 * <p>Meters:
 * <ul>
 *   <li>{@code courier.queue.messages{status}} - messages per status</li>
 *   <li>{@code courier.queue.processing} - 1 while a pass runs</li>
 *   <li>{@code courier.network.online} - 1 while online</li>
 *   <li>{@code courier.queue.attempts{channel,outcome}} - attempts by outcome: sent, retry or failed</li>
 * </ul>
 */
public class QueueMetrics implements QueueListener {

    private final MeterRegistry registry;
    private final Map<MessageStatus, AtomicInteger> counts = new EnumMap<>(MessageStatus.class);
    private final AtomicInteger processing = new AtomicInteger();
    private final AtomicInteger online = new AtomicInteger();

    /**
     * Constructs a new QueueMetrics instance and registers gauges.
     *
     * @param registry MeterRegistry instance.
     */
    public QueueMetrics(MeterRegistry registry) {
        this.registry = registry;

        for (MessageStatus status : MessageStatus.values()) {
            AtomicInteger count = new AtomicInteger();
            counts.put(status, count);
            Gauge.builder("courier.queue.messages", count, AtomicInteger::get)
                    .description("Queued messages by status")
                    .tag("status", status.getKey())
                    .register(registry);
        }

        Gauge.builder("courier.queue.processing", processing, AtomicInteger::get)
                .description("Processing pass running")
                .register(registry);
        Gauge.builder("courier.network.online", online, AtomicInteger::get)
                .description("Connectivity online flag")
                .register(registry);
    }

    /**
     * Initializes gauges from the queue and subscribes to its changes.
     *
     * @param queue MessageQueue instance.
     * @return Self.
     */
    public QueueMetrics bind(MessageQueue queue) {
        onQueueChanged(queue.getQueue());
        onProcessingChanged(queue.isProcessing());
        onOnlineChanged(queue.isOnline());
        queue.addListener(this);
        return this;
    }

    @Override
    public void onQueueChanged(List<QueuedMessage> snapshot) {
        QueueStats stats = QueueStats.of(snapshot);
        counts.get(MessageStatus.PENDING).set(stats.pending());
        counts.get(MessageStatus.SENDING).set(stats.sending());
        counts.get(MessageStatus.SENT).set(stats.sent());
        counts.get(MessageStatus.FAILED).set(stats.failed());
        counts.get(MessageStatus.RETRYING).set(stats.retrying());
    }

    @Override
    public void onProcessingChanged(boolean value) {
        processing.set(value ? 1 : 0);
    }

    @Override
    public void onOnlineChanged(boolean value) {
        online.set(value ? 1 : 0);
    }

    @Override
    public void onAttemptCompleted(QueuedMessage message, boolean success) {
        String outcome = success ? "sent" : (message.getStatus() == MessageStatus.FAILED ? "failed" : "retry");
        Counter.builder("courier.queue.attempts")
                .description("Delivery attempts by outcome")
                .tag("channel", message.getChannel().getKey())
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}

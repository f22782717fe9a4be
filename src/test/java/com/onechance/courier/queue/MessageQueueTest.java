package com.onechance.courier.queue;

import com.onechance.courier.config.server.QueueConfig;
import com.onechance.courier.network.StubConnectivity;
import com.onechance.courier.queue.payload.EmailPayload;
import com.onechance.courier.queue.payload.MmsPayload;
import com.onechance.courier.queue.payload.SmsPayload;
import com.onechance.courier.queue.store.InMemoryQueueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for queue operations.
 * <p>Passes run on the calling thread so every assertion sees the state after the pass.
 */
class MessageQueueTest {

    private MutableClock clock;
    private StubConnectivity connectivity;
    private InMemoryQueueStore store;
    private RecordingSender sender;
    private MessageQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        connectivity = new StubConnectivity(false);
        store = new InMemoryQueueStore();
        sender = new RecordingSender();
        queue = newQueue();
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    private MessageQueue newQueue() {
        QueueConfig config = new QueueConfig(Map.of(
                "maxAttempts", 5,
                "attemptDelayMillis", 0,
                "sendTimeoutMillis", 2000));
        return new MessageQueue(store, sender.senders(), connectivity, config, clock, Runnable::run);
    }

    private static EmailPayload email(String to) {
        return new EmailPayload(List.of(to), "Your photos", "See attached");
    }

    @Test
    void testOfflineEnqueueStaysPending() {
        String id = queue.enqueue(Channel.EMAIL, email("guest@example.com"));

        QueuedMessage message = queue.getMessage(id).orElseThrow();
        assertEquals(MessageStatus.PENDING, message.getStatus());
        assertEquals(0, message.getAttempts());
        assertTrue(sender.getRecipients().isEmpty(), "No send attempt while offline");

        queue.processQueue();
        assertTrue(sender.getRecipients().isEmpty(), "Explicit request is ignored while offline");

        connectivity.setOnline(true);
        assertEquals(List.of("guest@example.com"), sender.getRecipients());
        assertEquals(MessageStatus.SENT, queue.getMessage(id).orElseThrow().getStatus());
    }

    @Test
    void testEnqueuePersists() {
        String id = queue.enqueue(Channel.SMS, new SmsPayload(List.of("+15551234567"), "Hello"), MessagePriority.HIGH);

        List<QueuedMessage> persisted = store.load();
        assertEquals(1, persisted.size());
        assertEquals(id, persisted.get(0).getId());
        assertEquals(MessagePriority.HIGH, persisted.get(0).getPriority());
        assertEquals(MessageStatus.PENDING, persisted.get(0).getStatus());
    }

    @Test
    void testEnqueueRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> queue.enqueue(null, email("a@example.com")));
        assertThrows(IllegalArgumentException.class, () -> queue.enqueue(Channel.SMS, email("a@example.com")));
        assertEquals(0, queue.getStats().total());
    }

    @Test
    void testEnqueueWithoutRecipientsIsSentAfterOneAttempt() {
        String id = queue.enqueue(Channel.MMS, new MmsPayload(List.of(), "Hi", List.of("https://cdn.example.com/1.jpg")));
        assertEquals(MessageStatus.PENDING, queue.getMessage(id).orElseThrow().getStatus());

        connectivity.setOnline(true);

        QueuedMessage message = queue.getMessage(id).orElseThrow();
        assertEquals(MessageStatus.SENT, message.getStatus());
        assertEquals(1, message.getAttempts());
        assertNull(message.getLastError());
        assertTrue(sender.getRecipients().isEmpty());
    }

    @Test
    void testNullPriorityDefaultsToMedium() {
        String id = queue.enqueue(Channel.EMAIL, email("a@example.com"), null);
        assertEquals(MessagePriority.MEDIUM, queue.getMessage(id).orElseThrow().getPriority());
    }

    @Test
    void testRemove() {
        String id = queue.enqueue(Channel.EMAIL, email("a@example.com"));

        assertTrue(queue.remove(id));
        assertFalse(queue.remove(id));
        assertTrue(queue.getMessage(id).isEmpty());
        assertTrue(store.load().isEmpty());
    }

    @Test
    void testRetryOnPendingIsNoop() {
        String id = queue.enqueue(Channel.EMAIL, email("a@example.com"));

        assertFalse(queue.retryMessage(id));
        assertFalse(queue.retryMessage("missing"));

        QueuedMessage message = queue.getMessage(id).orElseThrow();
        assertEquals(MessageStatus.PENDING, message.getStatus());
        assertEquals(0, message.getAttempts());
    }

    @Test
    void testManualRetryOfFailedMessage() {
        sender.failWith("Provider down");
        connectivity.setOnline(true);
        QueueConfig config = new QueueConfig(Map.of("maxAttempts", 1, "attemptDelayMillis", 0));
        queue.close();
        queue = new MessageQueue(store, sender.senders(), connectivity, config, clock, Runnable::run);

        String id = queue.enqueue(Channel.EMAIL, email("a@example.com"));
        assertEquals(MessageStatus.FAILED, queue.getMessage(id).orElseThrow().getStatus());

        sender.behave((recipient, payload) -> {
        });
        assertTrue(queue.retryMessage(id));

        QueuedMessage message = queue.getMessage(id).orElseThrow();
        assertEquals(MessageStatus.SENT, message.getStatus());
        assertEquals(1, message.getAttempts(), "Manual retry resets the attempt count");
        assertNull(message.getLastError());
    }

    @Test
    void testClearSentMessages() {
        connectivity.setOnline(true);
        for (int i = 0; i < 3; i++) {
            queue.enqueue(Channel.EMAIL, email("sent" + i + "@example.com"));
        }
        connectivity.setOnline(false);
        String pending1 = queue.enqueue(Channel.EMAIL, email("p1@example.com"));
        String pending2 = queue.enqueue(Channel.EMAIL, email("p2@example.com"));
        assertEquals(3, queue.getStats().sent());

        assertEquals(3, queue.clearSentMessages());

        List<String> remaining = new ArrayList<>();
        for (QueuedMessage message : queue.getQueue()) {
            assertEquals(MessageStatus.PENDING, message.getStatus());
            remaining.add(message.getId());
        }
        assertEquals(List.of(pending1, pending2), remaining);
        assertEquals(2, store.load().size());
        assertEquals(0, queue.clearSentMessages());
    }

    @Test
    void testClearFailedMessages() {
        sender.failWith("Provider down");
        connectivity.setOnline(true);
        queue.close();
        queue = new MessageQueue(store, sender.senders(), connectivity,
                new QueueConfig(Map.of("maxAttempts", 1, "attemptDelayMillis", 0)), clock, Runnable::run);

        queue.enqueue(Channel.EMAIL, email("a@example.com"));
        queue.enqueue(Channel.EMAIL, email("b@example.com"));
        connectivity.setOnline(false);
        queue.enqueue(Channel.EMAIL, email("c@example.com"));

        assertEquals(2, queue.clearFailedMessages());
        assertEquals(1, queue.getStats().total());
        assertEquals(1, queue.getStats().pending());
    }

    @Test
    void testStats() {
        queue.enqueue(Channel.EMAIL, email("a@example.com"));
        queue.enqueue(Channel.SMS, new SmsPayload(List.of("+15551234567"), "Hi"));

        QueueStats stats = queue.getStats();
        assertEquals(2, stats.total());
        assertEquals(2, stats.pending());
        assertEquals(0, stats.sending());
        assertEquals(0, stats.sent());
        assertEquals(0, stats.failed());
        assertEquals(0, stats.retrying());
    }

    @Test
    void testSentNeverCarriesError() {
        connectivity.setOnline(true);
        sender.failWith("Timeout");
        String id = queue.enqueue(Channel.EMAIL, email("a@example.com"));
        assertEquals("Timeout", queue.getMessage(id).orElseThrow().getLastError());

        sender.behave((recipient, payload) -> {
        });
        clock.advance(RetryScheduler.getRetryDelay(1));
        queue.processQueue();

        QueuedMessage message = queue.getMessage(id).orElseThrow();
        assertEquals(MessageStatus.SENT, message.getStatus());
        assertNull(message.getLastError());
        assertNull(message.getNextRetryAt());
    }

    @Test
    void testListenersNotified() {
        List<Boolean> processing = new ArrayList<>();
        List<Boolean> online = new ArrayList<>();
        List<Boolean> outcomes = new ArrayList<>();
        List<Integer> sizes = new ArrayList<>();
        queue.addListener(new QueueListener() {
            @Override
            public void onQueueChanged(List<QueuedMessage> snapshot) {
                sizes.add(snapshot.size());
            }

            @Override
            public void onProcessingChanged(boolean value) {
                processing.add(value);
            }

            @Override
            public void onOnlineChanged(boolean value) {
                online.add(value);
            }

            @Override
            public void onAttemptCompleted(QueuedMessage message, boolean success) {
                outcomes.add(success);
            }
        });

        queue.enqueue(Channel.EMAIL, email("a@example.com"));
        connectivity.setOnline(true);

        assertEquals(List.of(true), online);
        assertEquals(List.of(true, false), processing);
        assertEquals(List.of(true), outcomes);
        assertEquals(List.of(1, 1, 1), sizes, "Enqueue, sending and sent each publish a snapshot");
    }

    @Test
    void testRemovedListenerNotNotified() {
        List<Integer> sizes = new ArrayList<>();
        QueueListener listener = new QueueListener() {
            @Override
            public void onQueueChanged(List<QueuedMessage> snapshot) {
                sizes.add(snapshot.size());
            }
        };
        queue.addListener(listener);
        queue.enqueue(Channel.EMAIL, email("a@example.com"));
        queue.removeListener(listener);
        queue.enqueue(Channel.EMAIL, email("b@example.com"));

        assertEquals(List.of(1), sizes);
    }

    @Test
    void testSnapshotsAreCopies() {
        String id = queue.enqueue(Channel.EMAIL, email("a@example.com"));
        QueuedMessage copy = queue.getQueue().get(0);
        copy.markSending(clock.instant());

        assertEquals(MessageStatus.PENDING, queue.getMessage(id).orElseThrow().getStatus());
    }

    @Test
    void testStartupRecoversInterruptedSends() {
        QueuedMessage interrupted = QueuedMessage.create(Channel.EMAIL, email("a@example.com"),
                MessagePriority.MEDIUM, 5, clock.instant());
        interrupted.markSending(clock.instant());
        QueuedMessage exhausted = QueuedMessage.create(Channel.EMAIL, email("b@example.com"),
                MessagePriority.MEDIUM, 1, clock.instant());
        exhausted.markSending(clock.instant());
        store.save(List.of(interrupted, exhausted));

        queue.close();
        queue = newQueue();

        QueuedMessage recovered = queue.getMessage(interrupted.getId()).orElseThrow();
        assertEquals(MessageStatus.RETRYING, recovered.getStatus());
        assertEquals("Interrupted during send", recovered.getLastError());
        assertEquals(1, recovered.getAttempts());
        assertEquals(MessageStatus.FAILED, queue.getMessage(exhausted.getId()).orElseThrow().getStatus());
        assertEquals(MessageStatus.RETRYING, store.load().get(0).getStatus(), "Recovery is persisted");

        connectivity.setOnline(true);
        assertEquals(MessageStatus.SENT, queue.getMessage(interrupted.getId()).orElseThrow().getStatus());
        assertEquals(List.of("a@example.com"), sender.getRecipients());
    }

    @Test
    void testRemoveDuringSend() {
        AtomicReference<String> id = new AtomicReference<>();
        sender.behave((recipient, payload) -> queue.remove(id.get()));
        id.set(queue.enqueue(Channel.EMAIL, email("a@example.com")));

        connectivity.setOnline(true);

        assertTrue(queue.getMessage(id.get()).isEmpty());
        assertEquals(0, queue.getStats().total());
    }

    @Test
    void testCloseDetachesFromConnectivity() {
        assertEquals(1, connectivity.getListenerCount());
        queue.close();
        assertEquals(0, connectivity.getListenerCount());

        queue.enqueue(Channel.EMAIL, email("a@example.com"));
        connectivity.setOnline(true);
        queue.processQueue();
        assertTrue(sender.getRecipients().isEmpty(), "Closed queue does not dispatch");
    }

    @Test
    void testPassRequestsCoalesce() {
        queue.close();
        List<Runnable> waiting = new ArrayList<>();
        QueueConfig config = new QueueConfig(Map.of("maxAttempts", 5, "attemptDelayMillis", 0, "sendTimeoutMillis", 2000));
        queue = new MessageQueue(store, sender.senders(), connectivity, config, clock, waiting::add);
        connectivity.setOnline(true);
        assertEquals(1, waiting.size());

        queue.enqueue(Channel.EMAIL, email("a@example.com"));
        queue.enqueue(Channel.EMAIL, email("b@example.com"));
        queue.processQueue();
        queue.processQueue();
        assertEquals(1, waiting.size(), "Requests before the pass starts collapse into one");

        waiting.remove(0).run();
        assertEquals(List.of("a@example.com", "b@example.com"), sender.getRecipients());
        assertEquals(2, queue.getStats().sent());

        queue.processQueue();
        assertEquals(1, waiting.size(), "A new request is accepted once the queued pass has started");
    }
}

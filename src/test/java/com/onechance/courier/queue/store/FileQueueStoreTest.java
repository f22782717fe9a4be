package com.onechance.courier.queue.store;

import com.onechance.courier.config.server.QueueConfig;
import com.onechance.courier.network.StubConnectivity;
import com.onechance.courier.queue.Channel;
import com.onechance.courier.queue.MessagePriority;
import com.onechance.courier.queue.MessageQueue;
import com.onechance.courier.queue.QueueStats;
import com.onechance.courier.queue.QueuedMessage;
import com.onechance.courier.queue.RecordingSender;
import com.onechance.courier.queue.payload.SmsPayload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileQueueStoreTest {

    @TempDir
    Path dir;

    private static QueuedMessage sms(String to) {
        return QueuedMessage.create(Channel.SMS, new SmsPayload(List.of(to), "Hi"), MessagePriority.MEDIUM, 5, Instant.now());
    }

    @Test
    void testMissingFileLoadsEmpty() {
        FileQueueStore store = new FileQueueStore(dir.resolve("nested"));
        assertTrue(store.load().isEmpty());
    }

    @Test
    void testSaveAndReload() {
        FileQueueStore store = new FileQueueStore(dir.resolve("nested"));
        QueuedMessage first = sms("+15551111111");
        QueuedMessage second = sms("+15552222222");

        store.save(List.of(first, second));

        assertTrue(Files.exists(dir.resolve("nested").resolve("message_queue.json")));
        assertFalse(Files.exists(dir.resolve("nested").resolve("message_queue.json.tmp")));

        List<QueuedMessage> loaded = new FileQueueStore(dir.resolve("nested")).load();
        assertEquals(List.of(first.getId(), second.getId()), List.of(loaded.get(0).getId(), loaded.get(1).getId()));
    }

    @Test
    void testSaveReplacesPreviousContent() {
        FileQueueStore store = new FileQueueStore(dir);
        store.save(List.of(sms("+15551111111"), sms("+15552222222")));
        store.save(List.of());

        assertTrue(store.load().isEmpty());
    }

    @Test
    void testCorruptFileLoadsEmpty() throws IOException {
        FileQueueStore store = new FileQueueStore(dir);
        Files.writeString(store.getFile(), "{not json", StandardCharsets.UTF_8);

        assertTrue(store.load().isEmpty());
    }

    @Test
    void testBlankFileLoadsEmpty() throws IOException {
        FileQueueStore store = new FileQueueStore(dir);
        Files.writeString(store.getFile(), "  ", StandardCharsets.UTF_8);

        assertTrue(store.load().isEmpty());
    }

    @Test
    void testNullPayloadChannelLoadsEmpty() throws IOException {
        FileQueueStore store = new FileQueueStore(dir);
        Files.writeString(store.getFile(), "[{\"id\":\"a\",\"payload\":{\"channel\":null}}]", StandardCharsets.UTF_8);

        assertTrue(store.load().isEmpty());
    }

    @Test
    void testQueueStartsOverPartlyCorruptFile() throws IOException {
        FileQueueStore store = new FileQueueStore(dir);
        QueuedMessage valid = sms("+15551111111");
        store.save(List.of(valid));
        String json = Files.readString(store.getFile(), StandardCharsets.UTF_8);
        String bogus = json.substring(1, json.length() - 1)
                .replace(valid.getId(), "bogus-status")
                .replace("\"status\":\"pending\"", "\"status\":\"bogus\"");
        Files.writeString(store.getFile(), "[" + bogus + "," + json.substring(1), StandardCharsets.UTF_8);

        MessageQueue queue = new MessageQueue(store, new RecordingSender().senders(), new StubConnectivity(false),
                new QueueConfig(Map.of("maxAttempts", 5)));
        try {
            QueueStats stats = queue.getStats();
            assertEquals(1, stats.total());
            assertEquals(1, stats.pending());
            assertTrue(queue.getMessage(valid.getId()).isPresent());
            assertTrue(queue.getMessage("bogus-status").isEmpty());
        } finally {
            queue.close();
        }
    }
}

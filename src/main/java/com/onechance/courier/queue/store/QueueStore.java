package com.onechance.courier.queue.store;

import com.onechance.courier.queue.QueuedMessage;

import java.io.Closeable;
import java.util.List;

/**
 * Interface for queue store implementations.
 * <p>Persists the full queue as a single named blob, key {@value #STORAGE_KEY}.
 * <p>Implementations never throw for I/O problems.
 * <br>A missing or unreadable blob loads as an empty queue and a failed save is logged only.
 */
public interface QueueStore extends Closeable {

    /**
     * Blob key.
     */
    String STORAGE_KEY = "message_queue";

    /**
     * Loads persisted messages.
     *
     * @return List of messages, empty when nothing usable is stored.
     */
    List<QueuedMessage> load();

    /**
     * Replaces persisted state with the given messages.
     *
     * @param messages Full queue contents.
     */
    void save(List<QueuedMessage> messages);

    /**
     * Close any resources.
     */
    @Override
    void close();
}

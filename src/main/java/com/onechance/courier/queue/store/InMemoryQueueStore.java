package com.onechance.courier.queue.store;

import com.onechance.courier.queue.QueuedMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory implementation of QueueStore.
 * <p>Keeps the serialized blob in memory so reads go through the same codec as persistent stores.
 * <p>Contents are lost on restart. Used for tests and when no backend is enabled.
 */
public class InMemoryQueueStore implements QueueStore {

    private volatile String blob;

    @Override
    public List<QueuedMessage> load() {
        String json = blob;
        return json != null ? QueueJson.fromJson(json) : new ArrayList<>();
    }

    @Override
    public void save(List<QueuedMessage> messages) {
        blob = QueueJson.toJson(messages);
    }

    @Override
    public void close() {
        // Nothing to close.
    }
}

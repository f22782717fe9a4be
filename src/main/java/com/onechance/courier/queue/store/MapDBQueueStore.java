package com.onechance.courier.queue.store;

import com.google.gson.JsonParseException;
import com.onechance.courier.queue.QueuedMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.HTreeMap;
import org.mapdb.Serializer;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * MapDB implementation of QueueStore.
 * <p>Keeps the blob under key {@value QueueStore#STORAGE_KEY} in a transactional file database.
 */
public class MapDBQueueStore implements QueueStore {
    private static final Logger log = LogManager.getLogger(MapDBQueueStore.class);

    private final File file;
    private final DB db;
    private final HTreeMap<String, String> blobs;

    /**
     * Constructs a new MapDBQueueStore instance and opens the database.
     *
     * @param file The file to store the database.
     */
    public MapDBQueueStore(File file) {
        this.file = file;
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            log.warn("Unable to create queue database directory: {}", parent);
        }

        this.db = DBMaker
                .fileDB(file)
                .fileChannelEnable()
                .transactionEnable()
                .make();
        this.blobs = db.hashMap("courier", Serializer.STRING, Serializer.STRING).createOrOpen();
        log.info("Opened MapDB queue store: {}", file.getAbsolutePath());
    }

    @Override
    public synchronized List<QueuedMessage> load() {
        try {
            String json = blobs.get(STORAGE_KEY);
            if (json == null || json.isBlank()) {
                return new ArrayList<>();
            }
            List<QueuedMessage> messages = QueueJson.fromJson(json);
            log.info("Loaded {} queued messages from {}", messages.size(), file.getAbsolutePath());
            return messages;
        } catch (JsonParseException e) {
            log.error("Corrupt queue blob in {}, starting empty: {}", file.getAbsolutePath(), e.getMessage());
            return new ArrayList<>();
        }
    }

    @Override
    public synchronized void save(List<QueuedMessage> messages) {
        try {
            blobs.put(STORAGE_KEY, QueueJson.toJson(messages));
            db.commit();
        } catch (RuntimeException e) {
            log.error("Unable to save queue to {}: {}", file.getAbsolutePath(), e.getMessage());
            try {
                db.rollback();
            } catch (RuntimeException rollbackError) {
                log.warn("Rollback failed: {}", rollbackError.getMessage());
            }
        }
    }

    @Override
    public synchronized void close() {
        if (!db.isClosed()) {
            db.close();
            log.debug("Closed MapDB queue store: {}", file.getAbsolutePath());
        }
    }
}

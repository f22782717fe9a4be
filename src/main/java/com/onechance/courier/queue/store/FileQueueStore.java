package com.onechance.courier.queue.store;

import com.google.gson.JsonParseException;
import com.onechance.courier.queue.QueuedMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON file implementation of QueueStore.
 * <p>The blob lives in {@code <dir>/message_queue.json}.
 * <br>Writes go to a temporary sibling first and are moved into place.
 */
public class FileQueueStore implements QueueStore {
    private static final Logger log = LogManager.getLogger(FileQueueStore.class);

    private final Path file;

    /**
     * Constructs a new FileQueueStore instance.
     *
     * @param dir Directory holding the blob file.
     */
    public FileQueueStore(Path dir) {
        this.file = dir.resolve(STORAGE_KEY + ".json");
    }

    /**
     * Gets the blob file path.
     *
     * @return Path.
     */
    public Path getFile() {
        return file;
    }

    @Override
    public List<QueuedMessage> load() {
        if (!Files.exists(file)) {
            log.info("No persisted queue at {}, starting empty", file);
            return new ArrayList<>();
        }

        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                return new ArrayList<>();
            }
            List<QueuedMessage> messages = QueueJson.fromJson(json);
            log.info("Loaded {} queued messages from {}", messages.size(), file);
            return messages;
        } catch (IOException | JsonParseException e) {
            log.error("Unable to load queue from {}, starting empty: {}", file, e.getMessage());
            return new ArrayList<>();
        }
    }

    @Override
    public void save(List<QueuedMessage> messages) {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, QueueJson.toJson(messages), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.trace("Saved {} queued messages to {}", messages.size(), file);
        } catch (IOException e) {
            log.error("Unable to save queue to {}: {}", file, e.getMessage());
        }
    }

    @Override
    public void close() {
        // Nothing to close.
    }
}

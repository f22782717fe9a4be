package com.onechance.courier.queue.store;

import com.onechance.courier.config.BasicConfig;
import com.onechance.courier.config.server.QueueConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.nio.file.Path;

/**
 * Factory for creating QueueStore instances based on configuration.
 * <p>Selects the backend by enabled flag in priority order:
 * <ol>
 *   <li>MapDB - if {@code queueMapDB.enabled} is true</li>
 *   <li>JSON file - if {@code queueFile.enabled} is true</li>
 *   <li>InMemory - fallback when all backends are disabled (default for tests)</li>
 * </ol>
 */
public class QueueStoreFactory {
    private static final Logger log = LogManager.getLogger(QueueStoreFactory.class);

    /**
     * Private constructor to prevent instantiation.
     */
    private QueueStoreFactory() {
        throw new IllegalStateException("Factory class");
    }

    /**
     * Creates a QueueStore instance based on configuration.
     *
     * @param config  Queue configuration.
     * @param dataDir Default directory for backend files.
     * @return QueueStore instance.
     */
    public static QueueStore create(QueueConfig config, String dataDir) {
        BasicConfig mapDB = config.getMapDB();
        if (mapDB.getBooleanProperty("enabled", false)) {
            String file = mapDB.getStringProperty("file", new File(dataDir, "courier-queue.db").getPath());
            log.info("Using MapDB queue store: {}", file);
            return new MapDBQueueStore(new File(file));
        }

        BasicConfig fileConfig = config.getFile();
        if (fileConfig.getBooleanProperty("enabled", false)) {
            String dir = fileConfig.getStringProperty("dir", dataDir);
            log.info("Using JSON file queue store in: {}", dir);
            return new FileQueueStore(Path.of(dir));
        }

        log.info("All queue stores disabled, using in-memory queue store");
        return new InMemoryQueueStore();
    }
}

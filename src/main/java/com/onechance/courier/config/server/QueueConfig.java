package com.onechance.courier.config.server;

import com.onechance.courier.config.BasicConfig;

import java.time.Duration;
import java.util.Map;

/**
 * Outbound queue configuration.
 *
 * <p>Holds dispatch timing, attempt bounds and persistence backend selection.
 * <p>Backends are nested objects with an {@code enabled} flag:
 * <pre>
 * {
 *   queueMapDB: { enabled: true, file: "/var/lib/courier/queue.db" },
 *   queueFile: { enabled: false, dir: "/var/lib/courier" }
 * }
 * </pre>
 */
public class QueueConfig extends BasicConfig {

    /**
     * Constructs a new QueueConfig instance.
     *
     * @param map Configuration map.
     */
    public QueueConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets maximum attempts per message.
     *
     * @return Attempts, default 5.
     */
    public int getMaxAttempts() {
        return Math.toIntExact(getLongProperty("maxAttempts", 5L));
    }

    /**
     * Gets the poll interval between scheduled passes.
     *
     * @return Duration, default 5 seconds.
     */
    public Duration getPollInterval() {
        return Duration.ofMillis(getLongProperty("pollIntervalMillis", 5000L));
    }

    /**
     * Gets the throttle delay between two attempts within a pass.
     *
     * @return Duration, default 500 milliseconds.
     */
    public Duration getAttemptDelay() {
        return Duration.ofMillis(getLongProperty("attemptDelayMillis", 500L));
    }

    /**
     * Gets the timeout applied to each single recipient send.
     *
     * @return Duration, default 30 seconds.
     */
    public Duration getSendTimeout() {
        return Duration.ofMillis(getLongProperty("sendTimeoutMillis", 30000L));
    }

    /**
     * Gets MapDB backend configuration.
     *
     * @return BasicConfig instance.
     */
    public BasicConfig getMapDB() {
        return new BasicConfig(getMapProperty("queueMapDB"));
    }

    /**
     * Gets JSON file backend configuration.
     *
     * @return BasicConfig instance.
     */
    public BasicConfig getFile() {
        return new BasicConfig(getMapProperty("queueFile"));
    }
}

package com.onechance.courier.config.server;

import com.onechance.courier.config.ConfigFoundation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server configuration.
 *
 * <p>This class provides type safe access to the service configuration.
 * <p>Each section is kept in its own JSON5 file next to {@code server.json5} and is loaded lazily.
 * <br>A section may also be inlined in {@code server.json5} under the same key.
 * <br>Missing files yield an empty section so every accessor falls back to its defaults.
 *
 * @see QueueConfig
 * @see NetworkConfig
 * @see SendGridConfig
 * @see TwilioConfig
 * @see EndpointConfig
 */
public class ServerConfig extends ConfigFoundation {
    private static final Logger log = LogManager.getLogger(ServerConfig.class);

    /**
     * Mapping of configuration keys to their filenames for lazy loading.
     */
    private static final Map<String, String> CONFIG_FILENAMES = new HashMap<>();

    static {
        CONFIG_FILENAMES.put("queue", "queue.json5");
        CONFIG_FILENAMES.put("network", "network.json5");
        CONFIG_FILENAMES.put("sendgrid", "sendgrid.json5");
        CONFIG_FILENAMES.put("twilio", "twilio.json5");
        CONFIG_FILENAMES.put("api", "api.json5");
    }

    /**
     * Configuration directory.
     */
    private final String configDir;

    /**
     * Loaded sections cache.
     */
    private final Map<String, Map<String, Object>> sections = new ConcurrentHashMap<>();

    /**
     * Constructs a new ServerConfig instance with defaults only.
     */
    public ServerConfig() {
        super();
        this.configDir = null;
    }

    /**
     * Constructs a new ServerConfig instance.
     *
     * @param map Configuration map.
     */
    public ServerConfig(Map<String, Object> map) {
        super(map);
        this.configDir = null;
    }

    /**
     * Constructs a new ServerConfig instance with configuration path.
     *
     * @param path Path to server.json5.
     * @throws IOException Unable to read file.
     */
    public ServerConfig(String path) throws IOException {
        super(path);
        this.configDir = new File(path).getParent();
    }

    /**
     * Gets the configuration directory.
     *
     * @return Directory path or null when built from a map.
     */
    public String getConfigDir() {
        return configDir;
    }

    /**
     * Gets the service name used in logs and metrics.
     *
     * @return Service name.
     */
    public String getName() {
        return getStringProperty("name", "courier");
    }

    /**
     * Gets data directory for persisted state.
     *
     * @return Directory path.
     */
    public String getDataDir() {
        return getStringProperty("dataDir", System.getProperty("java.io.tmpdir"));
    }

    /**
     * Gets queue configuration.
     *
     * @return QueueConfig instance.
     */
    public QueueConfig getQueue() {
        return new QueueConfig(getSection("queue"));
    }

    /**
     * Gets network configuration.
     *
     * @return NetworkConfig instance.
     */
    public NetworkConfig getNetwork() {
        return new NetworkConfig(getSection("network"));
    }

    /**
     * Gets SendGrid configuration.
     *
     * @return SendGridConfig instance.
     */
    public SendGridConfig getSendGrid() {
        return new SendGridConfig(getSection("sendgrid"));
    }

    /**
     * Gets Twilio configuration.
     *
     * @return TwilioConfig instance.
     */
    public TwilioConfig getTwilio() {
        return new TwilioConfig(getSection("twilio"));
    }

    /**
     * Gets API endpoint configuration.
     *
     * @return EndpointConfig instance.
     */
    public EndpointConfig getApi() {
        return new EndpointConfig(getSection("api"));
    }

    /**
     * Gets a configuration section, inline or from its own file.
     *
     * @param key Section key.
     * @return Map of String, Object.
     */
    Map<String, Object> getSection(String key) {
        if (map.get(key) instanceof Map) {
            return getMapProperty(key);
        }

        return sections.computeIfAbsent(key, this::loadSection);
    }

    /**
     * Loads a section file from the configuration directory.
     *
     * @param key Section key.
     * @return Map of String, Object, empty when unavailable.
     */
    private Map<String, Object> loadSection(String key) {
        String filename = CONFIG_FILENAMES.get(key);
        if (configDir == null || filename == null) {
            return new HashMap<>();
        }

        File file = new File(configDir, filename);
        if (!file.exists()) {
            log.debug("Config file not found, using defaults: {}", file.getAbsolutePath());
            return new HashMap<>();
        }

        try {
            return ConfigFoundation.readFile(file.getAbsolutePath());
        } catch (IOException e) {
            log.error("Unable to read config file {}: {}", file.getAbsolutePath(), e.getMessage());
            return new HashMap<>();
        }
    }
}

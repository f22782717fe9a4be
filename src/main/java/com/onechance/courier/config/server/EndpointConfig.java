package com.onechance.courier.config.server;

import com.onechance.courier.config.BasicConfig;

import java.util.Map;

/**
 * HTTP endpoint configuration.
 */
public class EndpointConfig extends BasicConfig {

    /**
     * Constructs a new EndpointConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public EndpointConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Checks if the endpoint should be started.
     *
     * @return Boolean, default true.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", true);
    }

    /**
     * Gets the port number for this endpoint.
     *
     * @param defaultPort Default port to use if not configured.
     * @return Port number.
     */
    public int getPort(int defaultPort) {
        return Math.toIntExact(getLongProperty("port", (long) defaultPort));
    }

    /**
     * Gets bind address.
     *
     * @return Address, default loopback.
     */
    public String getBind() {
        return getStringProperty("bind", "127.0.0.1");
    }
}

package com.onechance.courier.config.server;

import com.onechance.courier.config.BasicConfig;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Connectivity monitor configuration.
 */
public class NetworkConfig extends BasicConfig {

    /**
     * Default reachability probe endpoints.
     */
    public static final List<String> DEFAULT_ENDPOINTS = List.of(
            "https://www.google.com/favicon.ico",
            "https://www.cloudflare.com/favicon.ico",
            "https://httpbin.org/status/200"
    );

    /**
     * Constructs a new NetworkConfig instance.
     *
     * @param map Configuration map.
     */
    public NetworkConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets probe endpoints.
     *
     * @return List of URLs.
     */
    public List<String> getEndpoints() {
        return getStringListProperty("endpoints", DEFAULT_ENDPOINTS);
    }

    /**
     * Gets interval between background probes.
     *
     * @return Duration, default 10 seconds.
     */
    public Duration getCheckInterval() {
        return Duration.ofSeconds(getLongProperty("checkIntervalSeconds", 10L));
    }

    /**
     * Gets delay before the first background probe.
     *
     * @return Duration, default 1 second.
     */
    public Duration getInitialDelay() {
        return Duration.ofMillis(getLongProperty("initialDelayMillis", 1000L));
    }

    /**
     * Gets per endpoint probe timeout.
     *
     * @return Duration, default 5 seconds.
     */
    public Duration getProbeTimeout() {
        return Duration.ofSeconds(getLongProperty("probeTimeoutSeconds", 5L));
    }

    /**
     * Gets timeout of the timed latency test.
     *
     * @return Duration, default 10 seconds.
     */
    public Duration getLatencyTestTimeout() {
        return Duration.ofSeconds(getLongProperty("latencyTestTimeoutSeconds", 10L));
    }

    /**
     * Gets the online flag assumed before the first probe completes.
     *
     * @return Boolean, default false.
     */
    public boolean isInitiallyOnline() {
        return getBooleanProperty("initiallyOnline", false);
    }
}

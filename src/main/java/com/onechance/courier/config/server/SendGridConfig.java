package com.onechance.courier.config.server;

import com.onechance.courier.config.BasicConfig;

import java.util.Map;

/**
 * SendGrid email provider configuration.
 *
 * <p>The API key falls back to the {@code SENDGRID_API_KEY} environment variable.
 */
public class SendGridConfig extends BasicConfig {

    /**
     * Constructs a new SendGridConfig instance.
     *
     * @param map Configuration map.
     */
    public SendGridConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Checks if the provider is enabled.
     * <p>When disabled email messages go to the dry-run sender.
     *
     * @return Boolean.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", false);
    }

    /**
     * Gets API base URL.
     *
     * @return URL without trailing slash.
     */
    public String getBaseUrl() {
        return getStringProperty("baseUrl", "https://api.sendgrid.com");
    }

    /**
     * Gets API key.
     *
     * @return API key or empty string.
     */
    public String getApiKey() {
        return getStringProperty("apiKey", envOrEmpty("SENDGRID_API_KEY"));
    }

    /**
     * Gets sender address.
     *
     * @return Email address.
     */
    public String getFromEmail() {
        return getStringProperty("fromEmail", "sharing@onechancemedia.com");
    }

    /**
     * Gets sender display name.
     *
     * @return Name.
     */
    public String getFromName() {
        return getStringProperty("fromName", "One Chance Media");
    }

    /**
     * Gets HTTP timeout in seconds.
     *
     * @return Seconds.
     */
    public long getTimeoutSeconds() {
        return getLongProperty("timeoutSeconds", 30L);
    }

    static String envOrEmpty(String name) {
        String value = System.getenv(name);
        return value != null ? value : "";
    }
}

package com.onechance.courier.config.server;

import com.onechance.courier.config.BasicConfig;

import java.time.Duration;
import java.util.Map;

import static com.onechance.courier.config.server.SendGridConfig.envOrEmpty;

/**
 * Twilio SMS/MMS provider configuration.
 *
 * <p>Credentials fall back to {@code TWILIO_ACCOUNT_SID}, {@code TWILIO_AUTH_TOKEN}
 * and {@code TWILIO_PHONE_NUMBER} environment variables.
 */
public class TwilioConfig extends BasicConfig {

    /**
     * Constructs a new TwilioConfig instance.
     *
     * @param map Configuration map.
     */
    public TwilioConfig(Map<String, Object> map) {
        super(map);
    }

    public boolean isEnabled() {
        return getBooleanProperty("enabled", false);
    }

    public String getBaseUrl() {
        return getStringProperty("baseUrl", "https://api.twilio.com");
    }

    public String getAccountSid() {
        return getStringProperty("accountSid", envOrEmpty("TWILIO_ACCOUNT_SID"));
    }

    public String getAuthToken() {
        return getStringProperty("authToken", envOrEmpty("TWILIO_AUTH_TOKEN"));
    }

    public String getPhoneNumber() {
        return getStringProperty("phoneNumber", envOrEmpty("TWILIO_PHONE_NUMBER"));
    }

    /**
     * Gets the body used for media messages sent without text.
     *
     * @return Body text.
     */
    public String getDefaultMediaBody() {
        return getStringProperty("defaultMediaBody", "Here's your image!");
    }

    /**
     * Gets the pause between consecutive media messages to one recipient.
     *
     * @return Duration, default 1 second.
     */
    public Duration getMediaDelay() {
        return Duration.ofMillis(getLongProperty("mediaDelayMillis", 1000L));
    }

    public long getTimeoutSeconds() {
        return getLongProperty("timeoutSeconds", 30L);
    }
}

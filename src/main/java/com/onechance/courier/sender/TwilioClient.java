package com.onechance.courier.sender;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.onechance.courier.config.server.TwilioConfig;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Twilio Messages API client.
 * <p>Creates one message per call using form encoded POST with basic authentication.
 */
public class TwilioClient {
    private static final Logger log = LogManager.getLogger(TwilioClient.class);

    private final TwilioConfig config;
    private final OkHttpClient httpClient;

    /**
     * Constructs a new TwilioClient instance.
     *
     * @param config TwilioConfig instance.
     */
    public TwilioClient(TwilioConfig config) {
        this(config, new OkHttpClient());
    }

    /**
     * Constructs a new TwilioClient instance with given HTTP client.
     *
     * @param config     TwilioConfig instance.
     * @param httpClient Base HTTP client.
     */
    public TwilioClient(TwilioConfig config, OkHttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient.newBuilder()
                .connectTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    public TwilioConfig getConfig() {
        return config;
    }

    /**
     * Creates a message.
     *
     * @param to       Destination phone number, normalized here.
     * @param body     Body text, may be empty.
     * @param mediaUrl Media URL or null for text only.
     * @return Twilio message SID, may be null when the response has none.
     * @throws DeliveryException When configuration is missing or Twilio rejects the request.
     */
    public String createMessage(String to, String body, String mediaUrl) throws DeliveryException {
        String accountSid = config.getAccountSid();
        String authToken = config.getAuthToken();
        String from = config.getPhoneNumber();
        if (StringUtils.isAnyBlank(accountSid, authToken, from)) {
            throw new DeliveryException("Twilio configuration missing: SID=" + StringUtils.isNotBlank(accountSid) +
                    ", Token=" + StringUtils.isNotBlank(authToken) +
                    ", Phone=" + StringUtils.isNotBlank(from));
        }

        FormBody.Builder form = new FormBody.Builder()
                .add("From", from)
                .add("To", PhoneNumbers.normalize(to))
                .add("Body", StringUtils.defaultString(body));
        if (mediaUrl != null) {
            form.add("MediaUrl", mediaUrl);
        }

        Request request = new Request.Builder()
                .url(StringUtils.removeEnd(config.getBaseUrl(), "/") + "/2010-04-01/Accounts/" + accountSid + "/Messages.json")
                .header("Authorization", Credentials.basic(accountSid, authToken))
                .post(form.build())
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new DeliveryException("Twilio error: " + response.code() + " " + text);
            }

            String sid = parseSid(text);
            log.info("Message accepted by Twilio: to={}, sid={}, media={}", to, sid, mediaUrl != null);
            return sid;
        } catch (IOException e) {
            throw new DeliveryException("Twilio request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Extracts the message SID from a response.
     *
     * @param text Response body.
     * @return SID or null.
     */
    static String parseSid(String text) {
        try {
            JsonElement json = JsonParser.parseString(text);
            if (json.isJsonObject()) {
                JsonObject object = json.getAsJsonObject();
                return object.has("sid") && !object.get("sid").isJsonNull() ? object.get("sid").getAsString() : null;
            }
        } catch (JsonParseException e) {
            log.warn("Unreadable Twilio response: {}", e.getMessage());
        }
        return null;
    }
}

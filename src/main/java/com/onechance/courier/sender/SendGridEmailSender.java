package com.onechance.courier.sender;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.onechance.courier.config.server.SendGridConfig;
import com.onechance.courier.queue.payload.Attachment;
import com.onechance.courier.queue.payload.EmailPayload;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * SendGrid email sender.
 * <p>Posts one v3 mail send request per recipient.
 * <br>HTML content is preferred over plain text and attachments are passed inline as base64.
 */
public class SendGridEmailSender implements ChannelSender<EmailPayload> {
    private static final Logger log = LogManager.getLogger(SendGridEmailSender.class);

    private static final String SEND_ENDPOINT = "/v3/mail/send";
    private static final MediaType APPLICATION_JSON = MediaType.parse("application/json; charset=utf-8");

    private final SendGridConfig config;
    private final OkHttpClient httpClient;
    private final Gson gson = new Gson();

    /**
     * Constructs a new SendGridEmailSender instance.
     *
     * @param config SendGridConfig instance.
     */
    public SendGridEmailSender(SendGridConfig config) {
        this(config, new OkHttpClient());
    }

    /**
     * Constructs a new SendGridEmailSender instance with given HTTP client.
     *
     * @param config     SendGridConfig instance.
     * @param httpClient Base HTTP client.
     */
    public SendGridEmailSender(SendGridConfig config, OkHttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient.newBuilder()
                .connectTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Override
    public void send(String recipient, EmailPayload payload) throws DeliveryException {
        String apiKey = config.getApiKey();
        if (StringUtils.isBlank(apiKey)) {
            throw new DeliveryException("SendGrid configuration missing: API key");
        }

        Request request = new Request.Builder()
                .url(StringUtils.removeEnd(config.getBaseUrl(), "/") + SEND_ENDPOINT)
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(gson.toJson(buildBody(recipient, payload)), APPLICATION_JSON))
                .build();

        log.debug("Sending email: to={}, subject={}, attachments={}", recipient, payload.subject(), payload.attachments().size());
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                ResponseBody body = response.body();
                String errorText = body != null ? body.string() : "";
                throw new DeliveryException("SendGrid error: " + response.code() + " " + errorText);
            }
            log.info("Email accepted by SendGrid: to={}, status={}", recipient, response.code());
        } catch (IOException e) {
            throw new DeliveryException("SendGrid request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Builds the v3 mail send body.
     *
     * @param recipient Recipient address.
     * @param payload   EmailPayload instance.
     * @return JsonObject.
     */
    JsonObject buildBody(String recipient, EmailPayload payload) {
        JsonObject to = new JsonObject();
        to.addProperty("email", recipient);
        JsonArray toList = new JsonArray();
        toList.add(to);

        JsonObject personalization = new JsonObject();
        personalization.add("to", toList);
        personalization.addProperty("subject", StringUtils.defaultString(payload.subject()));
        JsonArray personalizations = new JsonArray();
        personalizations.add(personalization);

        JsonObject from = new JsonObject();
        from.addProperty("email", config.getFromEmail());
        from.addProperty("name", config.getFromName());

        JsonObject content = new JsonObject();
        if (StringUtils.isNotBlank(payload.html())) {
            content.addProperty("type", "text/html");
            content.addProperty("value", payload.html());
        } else {
            content.addProperty("type", "text/plain");
            content.addProperty("value", StringUtils.defaultIfEmpty(payload.text(), " "));
        }
        JsonArray contents = new JsonArray();
        contents.add(content);

        JsonObject body = new JsonObject();
        body.add("personalizations", personalizations);
        body.add("from", from);
        body.add("content", contents);

        if (!payload.attachments().isEmpty()) {
            JsonArray attachments = new JsonArray();
            for (Attachment attachment : payload.attachments()) {
                JsonObject item = new JsonObject();
                item.addProperty("content", attachment.content());
                item.addProperty("filename", attachment.filename());
                item.addProperty("type", StringUtils.defaultIfBlank(attachment.contentType(), "application/octet-stream"));
                item.addProperty("disposition", "attachment");
                attachments.add(item);
            }
            body.add("attachments", attachments);
        }

        return body;
    }
}

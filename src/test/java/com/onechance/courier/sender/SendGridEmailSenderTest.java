package com.onechance.courier.sender;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.onechance.courier.config.server.SendGridConfig;
import com.onechance.courier.queue.payload.Attachment;
import com.onechance.courier.queue.payload.EmailPayload;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SendGridEmailSender.
 * <p>MockWebServer simulates the SendGrid v3 API.
 */
class SendGridEmailSenderTest {

    private MockWebServer mockWebServer;
    private SendGridEmailSender sender;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        sender = new SendGridEmailSender(config("SG.test-key"));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private SendGridConfig config(String apiKey) {
        return new SendGridConfig(Map.of(
                "enabled", true,
                "baseUrl", mockWebServer.url("/").toString(),
                "apiKey", apiKey,
                "fromEmail", "sharing@example.com",
                "fromName", "Photo Booth",
                "timeoutSeconds", 5));
    }

    @Test
    void testSendPlainText() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(202));

        sender.send("guest@example.com", new EmailPayload(List.of("guest@example.com"), "Your photos", "Thanks for coming"));

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("POST", request.getMethod());
        assertEquals("/v3/mail/send", request.getPath());
        assertEquals("Bearer SG.test-key", request.getHeader("Authorization"));

        JsonObject body = JsonParser.parseString(request.getBody().readUtf8()).getAsJsonObject();
        JsonObject personalization = body.getAsJsonArray("personalizations").get(0).getAsJsonObject();
        assertEquals("guest@example.com", personalization.getAsJsonArray("to").get(0).getAsJsonObject().get("email").getAsString());
        assertEquals("Your photos", personalization.get("subject").getAsString());
        assertEquals("sharing@example.com", body.getAsJsonObject("from").get("email").getAsString());
        assertEquals("Photo Booth", body.getAsJsonObject("from").get("name").getAsString());

        JsonObject content = body.getAsJsonArray("content").get(0).getAsJsonObject();
        assertEquals("text/plain", content.get("type").getAsString());
        assertEquals("Thanks for coming", content.get("value").getAsString());
        assertFalse(body.has("attachments"));
    }

    @Test
    void testHtmlAndAttachments() {
        EmailPayload payload = new EmailPayload(List.of("guest@example.com"), "Photos", "ignored", "<b>Hi</b>",
                List.of(new Attachment("photo.jpg", "aGVsbG8=", "image/jpeg"), new Attachment("notes.bin", "AAAA", null)),
                "Gala", false, List.of());

        JsonObject body = sender.buildBody("guest@example.com", payload);

        JsonObject content = body.getAsJsonArray("content").get(0).getAsJsonObject();
        assertEquals("text/html", content.get("type").getAsString());
        assertEquals("<b>Hi</b>", content.get("value").getAsString());

        JsonObject first = body.getAsJsonArray("attachments").get(0).getAsJsonObject();
        assertEquals("photo.jpg", first.get("filename").getAsString());
        assertEquals("aGVsbG8=", first.get("content").getAsString());
        assertEquals("image/jpeg", first.get("type").getAsString());
        assertEquals("attachment", first.get("disposition").getAsString());
        assertEquals("application/octet-stream",
                body.getAsJsonArray("attachments").get(1).getAsJsonObject().get("type").getAsString());
    }

    @Test
    void testProviderError() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(401).setBody("{\"errors\":[{\"message\":\"bad key\"}]}"));

        DeliveryException e = assertThrows(DeliveryException.class,
                () -> sender.send("guest@example.com", new EmailPayload(List.of("guest@example.com"), "S", "T")));

        assertTrue(e.getMessage().startsWith("SendGrid error: 401"), e.getMessage());
        assertTrue(e.getMessage().contains("bad key"), e.getMessage());
    }

    @Test
    void testMissingApiKey() {
        SendGridEmailSender unconfigured = new SendGridEmailSender(config(""));

        DeliveryException e = assertThrows(DeliveryException.class,
                () -> unconfigured.send("guest@example.com", new EmailPayload(List.of("guest@example.com"), "S", "T")));

        assertEquals("SendGrid configuration missing: API key", e.getMessage());
        assertEquals(0, mockWebServer.getRequestCount());
    }

    @Test
    void testConnectionFailure() throws IOException {
        mockWebServer.shutdown();

        DeliveryException e = assertThrows(DeliveryException.class,
                () -> sender.send("guest@example.com", new EmailPayload(List.of("guest@example.com"), "S", "T")));

        assertTrue(e.getMessage().startsWith("SendGrid request failed: "), e.getMessage());
    }
}

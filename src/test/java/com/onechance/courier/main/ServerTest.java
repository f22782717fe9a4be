package com.onechance.courier.main;

import com.onechance.courier.config.server.ServerConfig;
import com.onechance.courier.queue.Channel;
import com.onechance.courier.queue.MessageStatus;
import com.onechance.courier.queue.payload.SmsPayload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Service wiring tests.
 * <p>Connectivity probes point at a closed port so the service stays offline.
 */
class ServerTest {

    @TempDir
    Path dir;

    private ServerConfig config() {
        return new ServerConfig(Map.of(
                "dataDir", dir.toString(),
                "queue", Map.of("queueFile", Map.of("enabled", true), "attemptDelayMillis", 0),
                "network", Map.of("endpoints", List.of("http://127.0.0.1:1/"), "initialDelayMillis", 60000),
                "api", Map.of("port", 0)));
    }

    @Test
    void testStartEnqueueAndReload() throws Exception {
        String id;
        Server server = new Server(config());
        try {
            server.start();
            assertNotNull(server.getEndpoint());
            assertFalse(server.getMonitor().isOnline());

            id = server.getQueue().enqueue(Channel.SMS, new SmsPayload(List.of("+15551234567"), "Hi"));
            assertEquals(MessageStatus.PENDING, server.getQueue().getMessage(id).orElseThrow().getStatus());

            HttpRequest request = HttpRequest.newBuilder(
                    URI.create("http://127.0.0.1:" + server.getEndpoint().getPort() + "/health")).GET().build();
            HttpResponse<String> response = HttpClient.newHttpClient().send(request, HttpResponse.BodyHandlers.ofString());
            assertEquals(200, response.statusCode());
            assertTrue(response.body().contains("\"status\":\"UP\""), response.body());
        } finally {
            server.close();
        }

        assertTrue(Files.exists(dir.resolve("message_queue.json")));

        Server reloaded = new Server(config());
        try {
            assertTrue(reloaded.getQueue().getMessage(id).isPresent(), "Queue survives restart");
        } finally {
            reloaded.close();
        }
    }

    @Test
    void testApiDisabled() {
        Server server = new Server(new ServerConfig(Map.of(
                "dataDir", dir.toString(),
                "network", Map.of("endpoints", List.of("http://127.0.0.1:1/"), "initialDelayMillis", 60000),
                "api", Map.of("enabled", false))));
        try {
            server.start();
            assertNull(server.getEndpoint());
        } finally {
            server.close();
        }
    }
}

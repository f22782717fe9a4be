package com.onechance.courier.endpoints;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.onechance.courier.queue.Channel;
import com.onechance.courier.queue.MessagePriority;
import com.onechance.courier.queue.MessageQueue;
import com.onechance.courier.queue.payload.MessagePayload;
import com.onechance.courier.queue.store.QueueJson;
import com.sun.net.httpserver.HttpExchange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handles queue mutating HTTP operations for the API endpoint.
 * <p>This class encapsulates:
 * <ul>
 *   <li>Enqueue of email, SMS and MMS messages</li>
 *   <li>Message removal</li>
 *   <li>Manual retry</li>
 *   <li>Clearing sent and failed messages</li>
 * </ul>
 */
public class QueueOperationsHandler {
    private static final Logger log = LogManager.getLogger(QueueOperationsHandler.class);

    private final ApiEndpoint apiEndpoint;
    private final MessageQueue queue;

    /**
     * Constructs a new QueueOperationsHandler.
     *
     * @param apiEndpoint The parent API endpoint for delegating common operations.
     * @param queue       MessageQueue instance.
     */
    public QueueOperationsHandler(ApiEndpoint apiEndpoint, MessageQueue queue) {
        this.apiEndpoint = apiEndpoint;
        this.queue = queue;
    }

    /**
     * Handles <b>POST /queue/enqueue</b> requests.
     * <p>Accepts JSON body {@code {"channel": "sms", "priority": "high", "payload": {...}}}.
     * <br>Priority is optional and defaults to medium.
     */
    public void handleEnqueue(HttpExchange exchange) throws IOException {
        if (!apiEndpoint.checkMethod(exchange, "POST")) {
            return;
        }

        log.info("POST /queue/enqueue from {}", exchange.getRemoteAddress());
        try {
            JsonObject body = readObject(exchange);
            if (body == null) {
                apiEndpoint.sendText(exchange, 400, "Invalid JSON body");
                return;
            }
            if (!body.has("channel") || !body.has("payload") || !body.get("payload").isJsonObject()) {
                apiEndpoint.sendText(exchange, 400, "Missing 'channel' or 'payload' parameter");
                return;
            }

            Channel channel = Channel.fromKey(body.get("channel").getAsString());
            MessagePriority priority = MessagePriority.fromKey(body.has("priority") ? body.get("priority").getAsString() : null);
            MessagePayload payload = QueueJson.GSON.fromJson(body.get("payload"), channel.getPayloadType());

            String id = queue.enqueue(channel, payload, priority);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "OK");
            response.put("id", id);
            apiEndpoint.sendJson(exchange, 200, QueueJson.GSON.toJson(response));
        } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException | JsonParseException e) {
            log.warn("Rejected /queue/enqueue: {}", e.getMessage());
            apiEndpoint.sendText(exchange, 400, "Bad Request: " + e.getMessage());
        } catch (Exception e) {
            log.error("Error processing /queue/enqueue: {}", e.getMessage(), e);
            apiEndpoint.sendText(exchange, 500, "Internal Server Error: " + e.getMessage());
        }
    }

    /**
     * Handles <b>POST /queue/remove</b> requests.
     * <p>Accepts JSON body {@code {"id": "..."}}.
     */
    public void handleRemove(HttpExchange exchange) throws IOException {
        if (!apiEndpoint.checkMethod(exchange, "POST")) {
            return;
        }

        log.info("POST /queue/remove from {}", exchange.getRemoteAddress());
        try {
            String id = readId(exchange);
            if (id == null) {
                return;
            }

            if (!queue.remove(id)) {
                sendResult(exchange, 404, "NOT_FOUND", false);
                return;
            }
            sendResult(exchange, 200, "OK", true);
        } catch (Exception e) {
            log.error("Error processing /queue/remove: {}", e.getMessage(), e);
            apiEndpoint.sendText(exchange, 500, "Internal Server Error: " + e.getMessage());
        }
    }

    /**
     * Handles <b>POST /queue/retry</b> requests.
     * <p>Accepts JSON body {@code {"id": "..."}}.
     * <br>Result is false when the message is not failed or retrying.
     */
    public void handleRetry(HttpExchange exchange) throws IOException {
        if (!apiEndpoint.checkMethod(exchange, "POST")) {
            return;
        }

        log.info("POST /queue/retry from {}", exchange.getRemoteAddress());
        try {
            String id = readId(exchange);
            if (id == null) {
                return;
            }

            if (queue.getMessage(id).isEmpty()) {
                sendResult(exchange, 404, "NOT_FOUND", false);
                return;
            }
            sendResult(exchange, 200, "OK", queue.retryMessage(id));
        } catch (Exception e) {
            log.error("Error processing /queue/retry: {}", e.getMessage(), e);
            apiEndpoint.sendText(exchange, 500, "Internal Server Error: " + e.getMessage());
        }
    }

    /**
     * Handles <b>POST /queue/clear-sent</b> requests.
     */
    public void handleClearSent(HttpExchange exchange) throws IOException {
        if (!apiEndpoint.checkMethod(exchange, "POST")) {
            return;
        }
        sendCleared(exchange, queue.clearSentMessages());
    }

    /**
     * Handles <b>POST /queue/clear-failed</b> requests.
     */
    public void handleClearFailed(HttpExchange exchange) throws IOException {
        if (!apiEndpoint.checkMethod(exchange, "POST")) {
            return;
        }
        sendCleared(exchange, queue.clearFailedMessages());
    }

    private void sendCleared(HttpExchange exchange, int cleared) throws IOException {
        log.info("{} {} cleared {} messages", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), cleared);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "OK");
        response.put("cleared", cleared);
        apiEndpoint.sendJson(exchange, 200, QueueJson.GSON.toJson(response));
    }

    private void sendResult(HttpExchange exchange, int code, String status, boolean result) throws IOException {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", status);
        response.put("result", result);
        apiEndpoint.sendJson(exchange, code, QueueJson.GSON.toJson(response));
    }

    /**
     * Reads the id field, answering 400 when missing.
     *
     * @return Id or null when a response was already sent.
     */
    private String readId(HttpExchange exchange) throws IOException {
        JsonObject body;
        try {
            body = readObject(exchange);
        } catch (JsonParseException e) {
            body = null;
        }

        if (body == null || !body.has("id") || !body.get("id").isJsonPrimitive()) {
            apiEndpoint.sendText(exchange, 400, "Missing 'id' parameter");
            return null;
        }
        return body.get("id").getAsString();
    }

    /**
     * Parses the body as a JSON object.
     *
     * @return JsonObject or null when blank or not an object.
     */
    private JsonObject readObject(HttpExchange exchange) throws IOException {
        String body = apiEndpoint.readBody(exchange.getRequestBody());
        if (body.isBlank()) {
            return null;
        }
        JsonElement json = JsonParser.parseString(body);
        return json.isJsonObject() ? json.getAsJsonObject() : null;
    }
}

package com.onechance.courier.endpoints;

import com.onechance.courier.config.server.EndpointConfig;
import com.onechance.courier.network.ConnectivityMonitor;
import com.onechance.courier.network.NetworkStatus;
import com.onechance.courier.queue.MessageQueue;
import com.onechance.courier.queue.QueuedMessage;
import com.onechance.courier.queue.RetryScheduler;
import com.onechance.courier.queue.store.QueueJson;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * API endpoint for queue inspection and management.
 *
 * <p>Starts a lightweight HTTP server consumed by the operator UI.
 *
 * <p>Endpoints:
 * <ul>
 *   <li><b>GET /queue</b> - All messages in store order.</li>
 *   <li><b>GET /queue/stats</b> - Counts by status.</li>
 *   <li><b>GET /queue/message?id=</b> - One message, 404 when unknown.</li>
 *   <li><b>POST /queue/enqueue</b> - Enqueue a message, see {@link QueueOperationsHandler#handleEnqueue}.</li>
 *   <li><b>POST /queue/remove</b>, <b>POST /queue/retry</b> - Act on one message by id.</li>
 *   <li><b>POST /queue/clear-sent</b>, <b>POST /queue/clear-failed</b> - Bulk removal by status.</li>
 *   <li><b>GET /network</b> - Connectivity status and quality.</li>
 *   <li><b>POST /network/check</b> - Fresh probe, then status.</li>
 *   <li><b>GET /metrics</b> - Prometheus scrape output.</li>
 *   <li><b>GET /health</b> - Liveness with queue summary.</li>
 * </ul>
 */
public class ApiEndpoint extends HttpEndpoint {
    private static final Logger log = LogManager.getLogger(ApiEndpoint.class);

    private final MessageQueue queue;
    private final ConnectivityMonitor monitor;
    private final PrometheusMeterRegistry prometheusRegistry;

    /**
     * Constructs a new ApiEndpoint instance.
     *
     * @param queue              MessageQueue instance.
     * @param monitor            ConnectivityMonitor instance.
     * @param prometheusRegistry Registry served on /metrics, may be null.
     */
    public ApiEndpoint(MessageQueue queue, ConnectivityMonitor monitor, PrometheusMeterRegistry prometheusRegistry) {
        this.queue = queue;
        this.monitor = monitor;
        this.prometheusRegistry = prometheusRegistry;
    }

    /**
     * Starts the API endpoint.
     *
     * @param config EndpointConfig with bind address and port, port 0 picks a free one.
     * @throws IOException If an I/O error occurs during server startup.
     */
    @Override
    public void start(EndpointConfig config) throws IOException {
        QueueOperationsHandler queueHandler = new QueueOperationsHandler(this, queue);

        int port = config.getPort(8090);
        server = HttpServer.create(new InetSocketAddress(config.getBind(), port), 10);

        // Queue inspection.
        server.createContext("/queue", this::handleQueue);
        server.createContext("/queue/stats", this::handleStats);
        server.createContext("/queue/message", this::handleMessage);

        // Queue operations.
        server.createContext("/queue/enqueue", queueHandler::handleEnqueue);
        server.createContext("/queue/remove", queueHandler::handleRemove);
        server.createContext("/queue/retry", queueHandler::handleRetry);
        server.createContext("/queue/clear-sent", queueHandler::handleClearSent);
        server.createContext("/queue/clear-failed", queueHandler::handleClearFailed);

        // Connectivity.
        server.createContext("/network", this::handleNetwork);
        server.createContext("/network/check", this::handleNetworkCheck);

        server.createContext("/metrics", this::handleMetrics);
        server.createContext("/health", this::handleHealth);

        server.start();
        log.info("API endpoint available at http://{}:{}/queue", config.getBind(), getPort());
    }

    /**
     * Handles <b>GET /queue</b> requests.
     */
    private void handleQueue(HttpExchange exchange) throws IOException {
        if (!"/queue".equals(exchange.getRequestURI().getPath()) && !"/queue/".equals(exchange.getRequestURI().getPath())) {
            sendText(exchange, 404, "Not Found");
            return;
        }
        if (!checkMethod(exchange, "GET")) {
            return;
        }

        List<QueuedMessage> messages = queue.getQueue();
        log.debug("GET /queue: messages={}", messages.size());
        sendJson(exchange, 200, QueueJson.toJson(messages));
    }

    /**
     * Handles <b>GET /queue/stats</b> requests.
     */
    private void handleStats(HttpExchange exchange) throws IOException {
        if (!checkMethod(exchange, "GET")) {
            return;
        }
        sendJson(exchange, 200, QueueJson.GSON.toJson(queue.getStats()));
    }

    /**
     * Handles <b>GET /queue/message?id=</b> requests.
     */
    private void handleMessage(HttpExchange exchange) throws IOException {
        if (!checkMethod(exchange, "GET")) {
            return;
        }

        String id = parseQuery(exchange.getRequestURI()).get("id");
        if (id == null || id.isBlank()) {
            sendText(exchange, 400, "Missing 'id' parameter");
            return;
        }

        Optional<QueuedMessage> message = queue.getMessage(id);
        if (message.isEmpty()) {
            sendText(exchange, 404, "Not Found");
            return;
        }
        sendJson(exchange, 200, QueueJson.GSON.toJson(message.get()));
    }

    /**
     * Handles <b>GET /network</b> requests.
     */
    private void handleNetwork(HttpExchange exchange) throws IOException {
        if (!checkMethod(exchange, "GET")) {
            return;
        }
        sendJson(exchange, 200, QueueJson.GSON.toJson(networkSummary()));
    }

    /**
     * Handles <b>POST /network/check</b> requests.
     */
    private void handleNetworkCheck(HttpExchange exchange) throws IOException {
        if (!checkMethod(exchange, "POST")) {
            return;
        }

        log.info("POST /network/check from {}", exchange.getRemoteAddress());
        monitor.forceCheck();
        sendJson(exchange, 200, QueueJson.GSON.toJson(networkSummary()));
    }

    /**
     * Handles <b>GET /metrics</b> requests.
     */
    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!checkMethod(exchange, "GET")) {
            return;
        }
        if (prometheusRegistry == null) {
            sendText(exchange, 404, "Metrics disabled");
            return;
        }
        sendResponse(exchange, 200, "text/plain; version=0.0.4; charset=utf-8", prometheusRegistry.scrape());
    }

    /**
     * Handles <b>GET /health</b> requests.
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("online", queue.isOnline());
        health.put("processing", queue.isProcessing());
        health.put("queue", queue.getStats());
        health.put("retryLadderSeconds", RetryScheduler.getLadder().stream().map(d -> d.getSeconds()).toList());
        sendJson(exchange, 200, QueueJson.GSON.toJson(health));
    }

    private Map<String, Object> networkSummary() {
        NetworkStatus status = monitor.getStatus();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("online", status.online());
        summary.put("quality", monitor.getConnectionQuality().name().toLowerCase(Locale.ROOT));
        summary.put("statusText", monitor.getStatusText());
        summary.put("rttMillis", status.rttMillis());
        summary.put("lastChecked", status.lastChecked());
        summary.put("lastOnline", status.lastOnline());
        summary.put("lastOffline", status.lastOffline());
        return summary;
    }
}

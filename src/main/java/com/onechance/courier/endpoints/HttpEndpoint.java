package com.onechance.courier.endpoints;

import com.onechance.courier.config.server.EndpointConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Abstract base class for HTTP endpoints.
 *
 * <p>Provides common functionality including:
 * <ul>
 *   <li>Server lifecycle with configurable bind address and port</li>
 *   <li>Response generation utilities for JSON and plain text</li>
 *   <li>Request body and query string parsing</li>
 * </ul>
 */
public abstract class HttpEndpoint {
    private static final Logger log = LogManager.getLogger(HttpEndpoint.class);

    /**
     * Embedded HTTP server instance.
     */
    protected HttpServer server;

    /**
     * Starts the HTTP endpoint with the given configuration.
     *
     * @param config EndpointConfig containing bind address and port.
     * @throws IOException If an I/O error occurs during server startup.
     */
    public abstract void start(EndpointConfig config) throws IOException;

    /**
     * Stops the HTTP endpoint.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            log.info("HTTP endpoint stopped");
            server = null;
        }
    }

    /**
     * Gets the bound port.
     *
     * @return Port or -1 when not started.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    /**
     * Sends a JSON response with the specified HTTP status code.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param json     JSON payload.
     * @throws IOException If an I/O error occurs.
     */
    void sendJson(HttpExchange exchange, int code, String json) throws IOException {
        sendResponse(exchange, code, "application/json; charset=utf-8", json);
    }

    /**
     * Sends a plain text response with the specified HTTP status code.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param text     Plain text payload.
     * @throws IOException If an I/O error occurs.
     */
    void sendText(HttpExchange exchange, int code, String text) throws IOException {
        sendResponse(exchange, code, "text/plain; charset=utf-8", text);
    }

    /**
     * Sends a response with the specified HTTP status code, content type, and payload.
     *
     * @param exchange    HTTP exchange.
     * @param code        HTTP status code.
     * @param contentType Content-Type header value.
     * @param response    Response payload.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendResponse(HttpExchange exchange, int code, String contentType, String response) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        log.debug("Sent response: status={}, contentType={}, bytes={}", code, contentType, bytes.length);
    }

    /**
     * Checks request method, answering 405 when it does not match.
     *
     * @param exchange       HTTP exchange.
     * @param expectedMethod Expected method.
     * @return True when the request may proceed.
     * @throws IOException If an I/O error occurs.
     */
    boolean checkMethod(HttpExchange exchange, String expectedMethod) throws IOException {
        if (!expectedMethod.equalsIgnoreCase(exchange.getRequestMethod())) {
            log.debug("Rejecting non-{} request: method={}", expectedMethod, exchange.getRequestMethod());
            sendText(exchange, 405, "Method Not Allowed");
            return false;
        }
        return true;
    }

    /**
     * Reads the request body as UTF-8.
     *
     * @param is Request body stream.
     * @return Body text.
     * @throws IOException If an I/O error occurs.
     */
    String readBody(InputStream is) throws IOException {
        try (is) {
            String body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            log.debug("Read request body ({} bytes)", body.length());
            return body;
        }
    }

    /**
     * Parses the query string from a URI into a map of key-value pairs.
     *
     * @param uri Request URI.
     * @return Map of query parameter names to values.
     */
    Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new HashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return map;
        }
        for (String pair : query.split("&")) {
            int idx = pair.indexOf('=');
            if (idx > 0) {
                map.put(urlDecode(pair.substring(0, idx)), urlDecode(pair.substring(idx + 1)));
            } else {
                map.put(urlDecode(pair), "");
            }
        }
        return map;
    }

    private String urlDecode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}

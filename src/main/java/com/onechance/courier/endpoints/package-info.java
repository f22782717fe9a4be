/**
 * HTTP operations endpoint.
 *
 * <p>Exposes the queue API, connectivity status and metrics as JSON over the JDK HTTP server.
 * <br>Port and bind address come from {@code api.json5}.
 */
package com.onechance.courier.endpoints;

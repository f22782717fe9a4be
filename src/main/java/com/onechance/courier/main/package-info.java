/**
 * Service bootstrap.
 *
 * <p>{@link com.onechance.courier.main.Foundation} loads configuration from a directory into
 * {@link com.onechance.courier.main.Config}.
 * <br>{@link com.onechance.courier.main.Server} wires the connectivity monitor, the queue store,
 * the channel senders, the queue, its poll cron, metrics and the operations endpoint.
 *
 * <p>Expected configuration directory layout:
 * <pre>
 * cfg/
 *   server.json5
 *   queue.json5
 *   network.json5
 *   sendgrid.json5
 *   twilio.json5
 *   api.json5
 * </pre>
 */
package com.onechance.courier.main;

/**
 * Handles the configuration of the Courier service.
 *
 * <p>Configuration lives in a directory of JSON5 files.
 * <br>{@code server.json5} holds top level settings and each section has its own file:
 * <ul>
 *   <li><b>queue.json5</b>: attempt bounds, dispatch timing and persistence backend.</li>
 *   <li><b>network.json5</b>: connectivity probe endpoints and intervals.</li>
 *   <li><b>sendgrid.json5</b>: email provider credentials.</li>
 *   <li><b>twilio.json5</b>: SMS and MMS provider credentials.</li>
 *   <li><b>api.json5</b>: operations endpoint port and bind address.</li>
 * </ul>
 *
 * <p>The Log4j2 XML filename can be configured via server.json5 {@code log4j2} property.
 * <br><b>Example:</b>
 * <pre>java -jar courier.jar --server cfg/</pre>
 */
package com.onechance.courier.config;

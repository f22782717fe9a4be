/**
 * Queue and connectivity metrics exposed through Micrometer.
 * <p>Production wiring uses a Prometheus registry scraped from the API endpoint {@code /metrics}.
 */
package com.onechance.courier.metrics;

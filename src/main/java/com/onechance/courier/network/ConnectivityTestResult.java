package com.onechance.courier.network;

/**
 * Outcome of a timed connectivity test.
 *
 * @param online        Whether the endpoint answered.
 * @param latencyMillis Round trip in milliseconds, null when offline.
 * @param error         Failure reason, null when online.
 */
public record ConnectivityTestResult(boolean online, Long latencyMillis, String error) {
}

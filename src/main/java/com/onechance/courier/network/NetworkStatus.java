package com.onechance.courier.network;

import java.time.Instant;

/**
 * Immutable connectivity snapshot.
 *
 * @param online      Online flag.
 * @param lastChecked Time of the last probe or notification.
 * @param lastOnline  Time of the last offline to online transition, may be null.
 * @param lastOffline Time of the last online to offline transition, may be null.
 * @param rttMillis   Last measured round trip in milliseconds, may be null.
 */
public record NetworkStatus(boolean online, Instant lastChecked, Instant lastOnline, Instant lastOffline, Long rttMillis) {

    /**
     * Initial status before any probe.
     *
     * @param online Assumed online flag.
     * @param now    Current time.
     * @return NetworkStatus instance.
     */
    public static NetworkStatus initial(boolean online, Instant now) {
        return new NetworkStatus(online, now, null, null, null);
    }

    /**
     * Derives the status after a check.
     * <p>Transition timestamps move only when the flag flips.
     *
     * @param isOnline Checked online flag.
     * @param now      Check time.
     * @param rtt      Measured round trip or null to keep the previous one.
     * @return NetworkStatus instance.
     */
    public NetworkStatus next(boolean isOnline, Instant now, Long rtt) {
        Instant onlineAt = lastOnline;
        Instant offlineAt = lastOffline;
        if (isOnline && !online) {
            onlineAt = now;
        } else if (!isOnline && online) {
            offlineAt = now;
        }
        return new NetworkStatus(isOnline, now, onlineAt, offlineAt, rtt != null ? rtt : rttMillis);
    }
}

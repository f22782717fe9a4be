package com.onechance.courier.network;

/**
 * Observer of connectivity transitions.
 * <p>Called only when the online flag actually changes.
 */
@FunctionalInterface
public interface ConnectivityListener {

    /**
     * Connectivity changed.
     *
     * @param online New online flag.
     */
    void onConnectivityChanged(boolean online);
}

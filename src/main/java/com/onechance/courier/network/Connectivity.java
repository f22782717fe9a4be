package com.onechance.courier.network;

/**
 * Online/offline signal consumed by the dispatcher.
 */
public interface Connectivity {

    /**
     * Gets the last computed status without blocking.
     *
     * @return Boolean.
     */
    boolean isOnline();

    /**
     * Registers a listener for online/offline transitions.
     *
     * @param listener ConnectivityListener instance.
     */
    void addListener(ConnectivityListener listener);

    /**
     * Unregisters a listener.
     *
     * @param listener ConnectivityListener instance.
     */
    void removeListener(ConnectivityListener listener);
}

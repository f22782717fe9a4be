/**
 * Connectivity monitoring.
 *
 * <p>Dispatch is gated on {@link com.onechance.courier.network.Connectivity#isOnline()}.
 * <br>{@link com.onechance.courier.network.ConnectivityMonitor} computes it with any-of-N HEAD probes.
 */
package com.onechance.courier.network;

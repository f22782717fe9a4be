package com.onechance.courier.network;

/**
 * Connection quality derived from round trip time.
 */
public enum ConnectionQuality {
    EXCELLENT("Excellent"),
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor"),
    OFFLINE("Offline");

    private final String label;

    ConnectionQuality(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Classifies a status.
     * <p>Under 100ms is excellent, under 300ms good, under 1s fair, anything slower poor.
     * <br>Without a measurement an online host is assumed good.
     *
     * @param status NetworkStatus instance.
     * @return ConnectionQuality.
     */
    public static ConnectionQuality of(NetworkStatus status) {
        if (!status.online()) {
            return OFFLINE;
        }
        Long rtt = status.rttMillis();
        if (rtt == null) {
            return GOOD;
        }
        if (rtt < 100) return EXCELLENT;
        if (rtt < 300) return GOOD;
        if (rtt < 1000) return FAIR;
        return POOR;
    }
}

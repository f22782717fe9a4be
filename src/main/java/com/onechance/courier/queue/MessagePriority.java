package com.onechance.courier.queue;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

/**
 * Dispatch priority of a queued message.
 * <p>Used for ordering only, higher rank goes first.
 */
public enum MessagePriority {
    @SerializedName("high")
    HIGH(3),

    @SerializedName("medium")
    MEDIUM(2),

    @SerializedName("low")
    LOW(1);

    private final int rank;

    MessagePriority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Resolves a priority by name, case insensitive.
     *
     * @param value Priority name, null or blank yields MEDIUM.
     * @return MessagePriority instance.
     * @throws IllegalArgumentException When unknown.
     */
    public static MessagePriority fromKey(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

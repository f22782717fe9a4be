package com.onechance.courier.queue;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

/**
 * Lifecycle status of a queued message.
 */
public enum MessageStatus {
    @SerializedName("pending")
    PENDING,

    @SerializedName("sending")
    SENDING,

    @SerializedName("sent")
    SENT,

    @SerializedName("failed")
    FAILED,

    @SerializedName("retrying")
    RETRYING;

    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.onechance.courier.queue;

import com.google.gson.annotations.SerializedName;
import com.onechance.courier.queue.payload.EmailPayload;
import com.onechance.courier.queue.payload.MessagePayload;
import com.onechance.courier.queue.payload.MmsPayload;
import com.onechance.courier.queue.payload.SmsPayload;

import java.util.Locale;

/**
 * Delivery medium of a queued message.
 */
public enum Channel {
    @SerializedName("email")
    EMAIL(EmailPayload.class),

    @SerializedName("sms")
    SMS(SmsPayload.class),

    @SerializedName("mms")
    MMS(MmsPayload.class);

    private final Class<? extends MessagePayload> payloadType;

    Channel(Class<? extends MessagePayload> payloadType) {
        this.payloadType = payloadType;
    }

    /**
     * Gets the payload variant carried by this channel.
     *
     * @return Payload class.
     */
    public Class<? extends MessagePayload> getPayloadType() {
        return payloadType;
    }

    /**
     * Gets the lowercase wire name.
     *
     * @return Name as used in ids and JSON.
     */
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a channel by its wire name, case insensitive.
     *
     * @param value Channel name.
     * @return Channel instance.
     * @throws IllegalArgumentException When unknown.
     */
    public static Channel fromKey(String value) {
        if (value != null) {
            for (Channel channel : values()) {
                if (channel.getKey().equalsIgnoreCase(value.trim())) {
                    return channel;
                }
            }
        }
        throw new IllegalArgumentException("Unknown channel: " + value);
    }
}

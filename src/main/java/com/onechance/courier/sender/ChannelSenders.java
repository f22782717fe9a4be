package com.onechance.courier.sender;

import com.onechance.courier.queue.payload.EmailPayload;
import com.onechance.courier.queue.payload.MessagePayload;
import com.onechance.courier.queue.payload.MmsPayload;
import com.onechance.courier.queue.payload.SmsPayload;

import java.util.Objects;

/**
 * Channel to sender mapping.
 */
public class ChannelSenders {

    private final ChannelSender<EmailPayload> email;
    private final ChannelSender<SmsPayload> sms;
    private final ChannelSender<MmsPayload> mms;

    /**
     * Constructs a new ChannelSenders instance.
     *
     * @param email Email sender.
     * @param sms   SMS sender.
     * @param mms   MMS sender.
     */
    public ChannelSenders(ChannelSender<EmailPayload> email, ChannelSender<SmsPayload> sms, ChannelSender<MmsPayload> mms) {
        this.email = Objects.requireNonNull(email, "email");
        this.sms = Objects.requireNonNull(sms, "sms");
        this.mms = Objects.requireNonNull(mms, "mms");
    }

    /**
     * Dispatches to the sender matching the payload's channel.
     *
     * @param recipient Recipient.
     * @param payload   Payload.
     * @throws DeliveryException When delivery failed.
     */
    public void send(String recipient, MessagePayload payload) throws DeliveryException {
        switch (payload.channel()) {
            case EMAIL -> email.send(recipient, (EmailPayload) payload);
            case SMS -> sms.send(recipient, (SmsPayload) payload);
            case MMS -> mms.send(recipient, (MmsPayload) payload);
        }
    }
}

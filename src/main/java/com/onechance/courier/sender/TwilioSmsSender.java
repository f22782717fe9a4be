package com.onechance.courier.sender;

import com.onechance.courier.queue.payload.SmsPayload;

/**
 * Twilio text message sender.
 */
public class TwilioSmsSender implements ChannelSender<SmsPayload> {

    private final TwilioClient client;

    public TwilioSmsSender(TwilioClient client) {
        this.client = client;
    }

    @Override
    public void send(String recipient, SmsPayload payload) throws DeliveryException {
        client.createMessage(recipient, payload.message(), null);
    }
}

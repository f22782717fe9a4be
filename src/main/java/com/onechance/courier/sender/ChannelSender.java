package com.onechance.courier.sender;

import com.onechance.courier.queue.payload.MessagePayload;

/**
 * Per channel delivery capability.
 * <p>Performs exactly one delivery attempt to one recipient.
 * <br>Attempt counting and retries belong to the dispatcher, never to the sender.
 *
 * @param <P> Payload variant handled.
 */
@FunctionalInterface
public interface ChannelSender<P extends MessagePayload> {

    /**
     * Sends the payload to one recipient.
     *
     * @param recipient Email address or phone number.
     * @param payload   Payload.
     * @throws DeliveryException When the provider did not accept the message.
     */
    void send(String recipient, P payload) throws DeliveryException;
}

package com.onechance.courier.sender;

import com.onechance.courier.queue.payload.MessagePayload;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Dry-run sender.
 * <p>Logs what would be sent and always succeeds.
 * <br>Used for channels whose provider is disabled in configuration.
 *
 * @param <P> Payload variant.
 */
public class LoggingChannelSender<P extends MessagePayload> implements ChannelSender<P> {
    private static final Logger log = LogManager.getLogger(LoggingChannelSender.class);

    @Override
    public void send(String recipient, P payload) {
        log.info("Dry-run {} delivery to {}: eventName={}", payload.channel().getKey(), recipient, payload.eventName());
    }
}

package com.onechance.courier.sender;

import com.onechance.courier.queue.payload.MmsPayload;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;

/**
 * Twilio media message sender.
 * <p>Sends one Twilio message per media URL, only the first one carries the body text.
 * <br>A pause between messages keeps bursts under provider rate limits.
 */
public class TwilioMmsSender implements ChannelSender<MmsPayload> {
    private static final Logger log = LogManager.getLogger(TwilioMmsSender.class);

    private final TwilioClient client;
    private final Duration mediaDelay;

    /**
     * Constructs a new TwilioMmsSender instance.
     *
     * @param client TwilioClient instance.
     */
    public TwilioMmsSender(TwilioClient client) {
        this.client = client;
        this.mediaDelay = client.getConfig().getMediaDelay();
    }

    @Override
    public void send(String recipient, MmsPayload payload) throws DeliveryException {
        List<String> mediaUrls = payload.mediaUrls();
        if (mediaUrls.isEmpty()) {
            client.createMessage(recipient, defaultBody(payload.message(), 1), null);
            return;
        }

        for (int i = 0; i < mediaUrls.size(); i++) {
            String body = i == 0 ? defaultBody(payload.message(), mediaUrls.size()) : "";
            log.debug("Sending media message {}/{} to {}", i + 1, mediaUrls.size(), recipient);
            try {
                client.createMessage(recipient, body, mediaUrls.get(i));
            } catch (DeliveryException e) {
                throw new DeliveryException(e.getMessage() + " (media " + (i + 1) + "/" + mediaUrls.size() + ")", e);
            }

            if (i < mediaUrls.size() - 1) {
                pause();
            }
        }
    }

    /**
     * Gets body text for the first message.
     *
     * @param message    Payload message.
     * @param mediaCount Number of media items.
     * @return Body text.
     */
    String defaultBody(String message, int mediaCount) {
        if (StringUtils.isNotBlank(message)) {
            return message;
        }
        return mediaCount > 1 ? mediaCount + " images from One Chance Media" : client.getConfig().getDefaultMediaBody();
    }

    private void pause() throws DeliveryException {
        if (mediaDelay.isZero() || mediaDelay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(mediaDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Interrupted between media messages", e);
        }
    }
}

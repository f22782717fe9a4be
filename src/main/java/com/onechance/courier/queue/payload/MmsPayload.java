package com.onechance.courier.queue.payload;

import com.onechance.courier.queue.Channel;

import java.util.List;

/**
 * MMS payload, text plus media references.
 *
 * @param to                Recipient phone numbers.
 * @param message           Message body, optional.
 * @param mediaUrls         Publicly reachable media URLs.
 * @param eventName         Associated event name, optional.
 * @param disclaimerEnabled Disclaimer flag.
 * @param surveyResponses   Survey answers.
 */
public record MmsPayload(List<String> to,
                         String message,
                         List<String> mediaUrls,
                         String eventName,
                         boolean disclaimerEnabled,
                         List<SurveyResponse> surveyResponses) implements MessagePayload {

    public MmsPayload {
        to = MessagePayload.listOf(to);
        mediaUrls = MessagePayload.listOf(mediaUrls);
        surveyResponses = MessagePayload.listOf(surveyResponses);
    }

    public MmsPayload(List<String> to, String message, List<String> mediaUrls) {
        this(to, message, mediaUrls, null, false, List.of());
    }

    @Override
    public Channel channel() {
        return Channel.MMS;
    }
}

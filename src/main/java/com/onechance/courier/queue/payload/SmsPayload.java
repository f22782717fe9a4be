package com.onechance.courier.queue.payload;

import com.onechance.courier.queue.Channel;

import java.util.List;

/**
 * Text only SMS payload.
 *
 * @param to                Recipient phone numbers.
 * @param message           Message body.
 * @param eventName         Associated event name, optional.
 * @param disclaimerEnabled Disclaimer flag.
 * @param surveyResponses   Survey answers.
 */
public record SmsPayload(List<String> to,
                         String message,
                         String eventName,
                         boolean disclaimerEnabled,
                         List<SurveyResponse> surveyResponses) implements MessagePayload {

    public SmsPayload {
        to = MessagePayload.listOf(to);
        surveyResponses = MessagePayload.listOf(surveyResponses);
    }

    public SmsPayload(List<String> to, String message) {
        this(to, message, null, false, List.of());
    }

    @Override
    public Channel channel() {
        return Channel.SMS;
    }
}

package com.onechance.courier.queue.payload;

import com.onechance.courier.queue.Channel;

import java.util.List;

/**
 * Email payload.
 * <p>When {@code html} is present it is sent as the body and {@code text} is ignored.
 *
 * @param to                Recipient addresses.
 * @param subject           Subject line.
 * @param text              Plain text body.
 * @param html              HTML body, optional.
 * @param attachments       Inline content attachments.
 * @param eventName         Associated event name, optional.
 * @param disclaimerEnabled Disclaimer flag.
 * @param surveyResponses   Survey answers.
 */
public record EmailPayload(List<String> to,
                           String subject,
                           String text,
                           String html,
                           List<Attachment> attachments,
                           String eventName,
                           boolean disclaimerEnabled,
                           List<SurveyResponse> surveyResponses) implements MessagePayload {

    public EmailPayload {
        to = MessagePayload.listOf(to);
        attachments = MessagePayload.listOf(attachments);
        surveyResponses = MessagePayload.listOf(surveyResponses);
    }

    /**
     * Constructs a plain text email without metadata.
     *
     * @param to      Recipient addresses.
     * @param subject Subject line.
     * @param text    Plain text body.
     */
    public EmailPayload(List<String> to, String subject, String text) {
        this(to, subject, text, null, List.of(), null, false, List.of());
    }

    @Override
    public Channel channel() {
        return Channel.EMAIL;
    }
}

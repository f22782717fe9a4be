package com.onechance.courier.queue.payload;

import com.onechance.courier.queue.Channel;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Channel specific content of a queued message.
 * <p>One variant per {@link Channel}, each carrying only the fields its channel needs.
 * <p>Payloads are immutable once created.
 */
public sealed interface MessagePayload permits EmailPayload, SmsPayload, MmsPayload {

    /**
     * Gets the channel this payload belongs to.
     *
     * @return Channel.
     */
    Channel channel();

    /**
     * Gets recipients, email addresses or phone numbers.
     *
     * @return Unmodifiable list.
     */
    List<String> to();

    /**
     * Gets the associated event name.
     *
     * @return Event name or null.
     */
    String eventName();

    /**
     * Checks if the event disclaimer was shown and accepted.
     *
     * @return Boolean.
     */
    boolean disclaimerEnabled();

    /**
     * Gets survey answers collected with the share.
     *
     * @return Unmodifiable list.
     */
    List<SurveyResponse> surveyResponses();

    /**
     * Null safe immutable copy, null elements dropped.
     */
    static <T> List<T> listOf(List<T> list) {
        if (list == null) {
            return List.of();
        }
        return list.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }
}

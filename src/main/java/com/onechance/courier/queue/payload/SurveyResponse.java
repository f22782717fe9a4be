package com.onechance.courier.queue.payload;

/**
 * Answer to one event survey question.
 *
 * @param questionId Question identifier.
 * @param answer     Answer text.
 */
public record SurveyResponse(String questionId, String answer) {
}

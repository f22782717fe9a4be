package com.onechance.courier.queue.payload;

/**
 * Email attachment carried inline.
 *
 * @param filename    File name shown to the recipient.
 * @param content     Base64 encoded content.
 * @param contentType MIME type.
 */
public record Attachment(String filename, String content, String contentType) {
}

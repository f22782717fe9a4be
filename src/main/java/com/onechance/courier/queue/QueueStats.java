package com.onechance.courier.queue;

import java.util.Collection;

/**
 * Point in time message counts by status.
 */
public record QueueStats(int total, int pending, int sending, int sent, int failed, int retrying) {

    /**
     * Counts messages by status.
     *
     * @param messages Messages.
     * @return QueueStats instance.
     */
    public static QueueStats of(Collection<QueuedMessage> messages) {
        int pending = 0, sending = 0, sent = 0, failed = 0, retrying = 0;
        for (QueuedMessage message : messages) {
            switch (message.getStatus()) {
                case PENDING -> pending++;
                case SENDING -> sending++;
                case SENT -> sent++;
                case FAILED -> failed++;
                case RETRYING -> retrying++;
            }
        }
        return new QueueStats(messages.size(), pending, sending, sent, failed, retrying);
    }
}

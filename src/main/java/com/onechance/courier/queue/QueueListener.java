package com.onechance.courier.queue;

import java.util.List;

/**
 * Observer of queue state.
 * <p>Callbacks run synchronously on the thread that made the change and must return quickly.
 */
public interface QueueListener {

    /**
     * Queue contents changed.
     *
     * @param snapshot Copy of all messages after the change.
     */
    default void onQueueChanged(List<QueuedMessage> snapshot) {
    }

    /**
     * Processing flag changed.
     *
     * @param processing True while a pass runs.
     */
    default void onProcessingChanged(boolean processing) {
    }

    /**
     * Online flag changed.
     *
     * @param online Online flag.
     */
    default void onOnlineChanged(boolean online) {
    }

    /**
     * A delivery attempt completed.
     *
     * @param message Message after the attempt.
     * @param success Whether the attempt delivered to all remaining recipients.
     */
    default void onAttemptCompleted(QueuedMessage message, boolean success) {
    }
}

/**
 * Outbound message queue.
 *
 * <p>Messages move through:
 * <pre>
 * pending  --attempt--> sending --success--> sent
 * sending  --failure, attempts &lt; max--> retrying
 * sending  --failure, attempts == max--> failed
 * retrying --nextRetryAt elapsed, attempt--> sending
 * retrying|failed --manual retry--> pending
 * </pre>
 *
 * <p>{@link com.onechance.courier.queue.MessageQueue} is the operations surface.
 * <br>{@link com.onechance.courier.queue.MessageDispatcher} runs the passes.
 * <br>{@link com.onechance.courier.queue.MessageQueueCron} polls every few seconds.
 * <br>{@link com.onechance.courier.queue.RetryScheduler} holds the backoff ladder.
 */
package com.onechance.courier.queue;

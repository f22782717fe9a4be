/**
 * Queue persistence.
 *
 * <p>The whole queue is stored as one JSON array under the {@code message_queue} key.
 * <br>Backends:
 * <ul>
 *   <li>{@link com.onechance.courier.queue.store.MapDBQueueStore} - transactional MapDB file.</li>
 *   <li>{@link com.onechance.courier.queue.store.FileQueueStore} - plain JSON file replaced atomically.</li>
 *   <li>{@link com.onechance.courier.queue.store.InMemoryQueueStore} - no persistence.</li>
 * </ul>
 */
package com.onechance.courier.queue.store;

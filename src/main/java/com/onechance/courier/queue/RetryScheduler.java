package com.onechance.courier.queue;

import java.time.Duration;
import java.util.List;

/**
 * Retry scheduler utility class.
 * <p>Schedules retries of failed sends using a fixed backoff ladder.
 * <p>The delay before the next attempt is picked by the number of attempts already made:
 * <pre>
 *     delay = LADDER[min(attempts - 1, LADDER.length - 1)]
 * </pre>
 * <p> Ladder:
 * <ul>
 *     <li>After attempt 1: 1 second</li>
 *     <li>After attempt 2: 5 seconds</li>
 *     <li>After attempt 3: 30 seconds</li>
 *     <li>After attempt 4: 1 minute</li>
 *     <li>After attempt 5 and beyond: 5 minutes</li>
 * </ul>
 * <p> Example usage:
 * <pre>
 *     Instant next = now.plus(RetryScheduler.getRetryDelay(message.getAttempts()));
 * </pre>
 */
public class RetryScheduler {

    private static final List<Duration> LADDER = List.of(
            Duration.ofSeconds(1),
            Duration.ofSeconds(5),
            Duration.ofSeconds(30),
            Duration.ofSeconds(60),
            Duration.ofSeconds(300)
    );

    /**
     * Private constructor to prevent instantiation.
     */
    private RetryScheduler() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets the delay before the next attempt.
     *
     * @param attempts Attempts made so far, including the one that just failed.
     * @return Delay, clamped to the ladder bounds.
     */
    public static Duration getRetryDelay(int attempts) {
        int index = Math.min(Math.max(attempts - 1, 0), LADDER.size() - 1);
        return LADDER.get(index);
    }

    // Exposed for health output.
    public static List<Duration> getLadder() {
        return LADDER;
    }
}

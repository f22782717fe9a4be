package com.onechance.courier.queue;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RetrySchedulerTest {

    @Test
    void testFirstRetry() {
        assertEquals(Duration.ofSeconds(1), RetryScheduler.getRetryDelay(1), "First retry should be 1 second");
    }

    @Test
    void testLadder() {
        assertEquals(Duration.ofSeconds(5), RetryScheduler.getRetryDelay(2));
        assertEquals(Duration.ofSeconds(30), RetryScheduler.getRetryDelay(3));
        assertEquals(Duration.ofMinutes(1), RetryScheduler.getRetryDelay(4));
        assertEquals(Duration.ofMinutes(5), RetryScheduler.getRetryDelay(5));
    }

    @Test
    void testClampedAfterLadderEnd() {
        assertEquals(Duration.ofMinutes(5), RetryScheduler.getRetryDelay(6));
        assertEquals(Duration.ofMinutes(5), RetryScheduler.getRetryDelay(100));
    }

    @Test
    void testIncreasingWaitTimes() {
        Duration prev = RetryScheduler.getRetryDelay(1);
        for (int i = 2; i < 10; i++) {
            Duration current = RetryScheduler.getRetryDelay(i);
            assertTrue(current.compareTo(prev) >= 0, "Wait time should not decrease");
            prev = current;
        }
    }

    @Test
    void testZeroOrNegativeAttempts() {
        assertEquals(Duration.ofSeconds(1), RetryScheduler.getRetryDelay(0), "Zero attempts should use first wait");
        assertEquals(Duration.ofSeconds(1), RetryScheduler.getRetryDelay(-3), "Negative attempts should use first wait");
    }

    @Test
    void testLadderIsUnmodifiable() {
        assertEquals(5, RetryScheduler.getLadder().size());
        assertThrows(UnsupportedOperationException.class, () -> RetryScheduler.getLadder().add(Duration.ZERO));
    }
}

package com.example.eventrelay.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryBackoffTest {

    @Test
    void testExponentialTable() {
        long[] expected = {1, 5, 15, 60, 360, 1440, 1440, 1440};
        for (int attempts = 0; attempts < expected.length; attempts++) {
            assertEquals(Duration.ofMinutes(expected[attempts]), RetryBackoff.EXPONENTIAL.delayAfter(attempts),
                    "attempts=" + attempts);
        }
    }

    @Test
    void testLinear() {
        assertEquals(Duration.ofMinutes(1), RetryBackoff.LINEAR.delayAfter(0));
        assertEquals(Duration.ofMinutes(2), RetryBackoff.LINEAR.delayAfter(1));
        assertEquals(Duration.ofMinutes(7), RetryBackoff.LINEAR.delayAfter(6));
    }

    @Test
    void testNegativeAttemptsClampToFirstStep() {
        assertEquals(Duration.ofMinutes(1), RetryBackoff.EXPONENTIAL.delayAfter(-3));
        assertEquals(Duration.ofMinutes(1), RetryBackoff.LINEAR.delayAfter(-3));
    }
}

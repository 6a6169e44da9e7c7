package com.ochre.websocket.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    private static final Duration BASE = Duration.ofMillis(500);
    private static final Duration JITTER = Duration.ofMillis(250);

    @Test
    void delaysStayWithinBounds() {
        BackoffPolicy policy = new BackoffPolicy(BASE, 5, JITTER, new Random(42));

        for (int attempt = 0; attempt < 12; attempt++) {
            for (int sample = 0; sample < 50; sample++) {
                Duration delay = policy.delayFor(attempt);
                long exponent = Math.min(attempt, 5);
                long lower = BASE.toMillis() << exponent;
                assertTrue(delay.toMillis() >= lower, "attempt " + attempt + " below bound: " + delay);
                assertTrue(delay.toMillis() <= lower + JITTER.toMillis(), "attempt " + attempt + " above bound: " + delay);
            }
        }
    }

    @Test
    void lowerBoundDoublesUntilTheCap() {
        BackoffPolicy policy = new BackoffPolicy(BASE, 3, JITTER, new Random());

        assertEquals(Duration.ofMillis(500), policy.lowerBound(0));
        assertEquals(Duration.ofMillis(1000), policy.lowerBound(1));
        assertEquals(Duration.ofMillis(2000), policy.lowerBound(2));
        assertEquals(Duration.ofMillis(4000), policy.lowerBound(3));
        assertEquals(Duration.ofMillis(4000), policy.lowerBound(4));
        assertEquals(Duration.ofMillis(4000), policy.lowerBound(30));

        for (int attempt = 1; attempt < 10; attempt++) {
            assertTrue(policy.lowerBound(attempt).compareTo(policy.lowerBound(attempt - 1)) >= 0);
        }
    }

    @Test
    void jitterNeverExceedsItsMaximum() {
        Random maximal = new Random() {
            @Override
            public double nextDouble() {
                return Math.nextDown(1.0);
            }
        };
        BackoffPolicy policy = new BackoffPolicy(BASE, 5, JITTER, maximal);

        assertEquals(Duration.ofMillis(750), policy.delayFor(0));
        assertEquals(policy.upperBound(0), policy.delayFor(0));
    }

    @Test
    void zeroJitterIsExact() {
        BackoffPolicy policy = new BackoffPolicy(BASE, 5, Duration.ZERO, new Random());

        assertEquals(Duration.ofMillis(2000), policy.delayFor(2));
    }

    @Test
    void rejectsNegativeParameters() {
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofMillis(-1), 5, JITTER, new Random()));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(BASE, -1, JITTER, new Random()));
    }
}

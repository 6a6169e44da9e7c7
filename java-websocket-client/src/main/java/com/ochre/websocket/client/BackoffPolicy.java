package com.ochre.websocket.client;

import java.time.Duration;
import java.util.Random;

/**
 * Reconnect delays: {@code base * 2^min(attempt, capExponent)} plus a random
 * jitter in {@code [0, jitterMax]}.
 */
public class BackoffPolicy {

    private final Duration base;
    private final int capExponent;
    private final Duration jitterMax;
    private final Random random;

    public BackoffPolicy(Duration base, int capExponent, Duration jitterMax, Random random) {
        if (base.isNegative() || jitterMax.isNegative() || capExponent < 0) {
            throw new IllegalArgumentException("Backoff parameters must not be negative");
        }
        this.base = base;
        this.capExponent = capExponent;
        this.jitterMax = jitterMax;
        this.random = random;
    }

    public static BackoffPolicy from(ClientOptions options) {
        return new BackoffPolicy(options.getBackoffBase(), options.getBackoffCapExponent(),
                options.getBackoffJitterMax(), new Random());
    }

    public Duration delayFor(int attempt) {
        long jitter = jitterMax.isZero() ? 0 : (long) (random.nextDouble() * (jitterMax.toMillis() + 1));
        return lowerBound(attempt).plusMillis(Math.min(jitter, jitterMax.toMillis()));
    }

    public Duration lowerBound(int attempt) {
        int exponent = Math.min(Math.max(attempt, 0), capExponent);
        return base.multipliedBy(1L << exponent);
    }

    public Duration upperBound(int attempt) {
        return lowerBound(attempt).plus(jitterMax);
    }
}

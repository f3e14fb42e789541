package com.ledgersync.sync;

import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;

/**
 * Exponential reconnect delay: starts at the minimum, doubles per failed attempt, capped at
 * the maximum. {@link #reset()} after every successful connect.
 *
 * <p>Not thread-safe; owned by the sync worker.
 */
public class ReconnectBackoff {

    private static final double MULTIPLIER = 2.0;

    private final IntervalFunction intervalFunction;
    private int attempt;

    public ReconnectBackoff(Duration minDelay, Duration maxDelay) {
        long min = Math.max(1, minDelay.toMillis());
        long max = Math.max(min, maxDelay.toMillis());
        this.intervalFunction = IntervalFunction.ofExponentialBackoff(min, MULTIPLIER, max);
    }

    /** Delay to wait before the next attempt; each call advances the sequence. */
    public Duration nextDelay() {
        attempt++;
        return Duration.ofMillis(intervalFunction.apply(attempt));
    }

    public void reset() {
        attempt = 0;
    }

    public int getAttempt() {
        return attempt;
    }
}

package com.example.ficregistry.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;

/**
 * Keeps at least {@code minDelay} between the starts of successive calls to
 * {@link #acquire()}, sleeping the remainder when a caller arrives early.
 */
public class MinimumIntervalThrottle {

    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration minDelay;
    private Instant lastStart;

    public MinimumIntervalThrottle(Clock clock, Sleeper sleeper, Duration minDelay) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.minDelay = minDelay;
    }

    public synchronized void acquire() {
        if (lastStart != null) {
            long waitMillis = minDelay.minus(Duration.between(lastStart, clock.instant())).toMillis();
            if (waitMillis > 0) {
                try {
                    sleeper.sleep(waitMillis);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new BackOffInterruptedException("Interrupted while waiting for rate limit", ex);
                }
            }
        }
        lastStart = clock.instant();
    }

    public Duration getMinDelay() {
        return minDelay;
    }
}

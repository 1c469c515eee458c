package com.example.acgarden.utils;

import com.example.acgarden.exception.NetworkException;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum gap between the end of one request and the start of the
 * next. Not thread-safe: one instance belongs to one sequential run.
 */
public class RateLimiter {

    /**
     * Blocking pause, swappable so tests do not sleep for real.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final long minIntervalNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;

    private boolean released;
    private long lastReleaseNanos;

    public RateLimiter(Duration minInterval) {
        this(minInterval, System::nanoTime, Thread::sleep);
    }

    public RateLimiter(Duration minInterval, LongSupplier nanoClock, Sleeper sleeper) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative: " + minInterval);
        }
        this.minIntervalNanos = minInterval.toNanos();
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    /**
     * Block until the interval since the last {@link #release()} has passed.
     * The first call of a fresh limiter returns immediately.
     */
    public void acquire() {
        if (!released) {
            return;
        }
        long remaining = minIntervalNanos - (nanoClock.getAsLong() - lastReleaseNanos);
        while (remaining > 0) {
            try {
                sleeper.sleep(Math.max(1L, Duration.ofNanos(remaining).toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NetworkException("Interrupted while waiting for the request throttle", e);
            }
            remaining = minIntervalNanos - (nanoClock.getAsLong() - lastReleaseNanos);
        }
    }

    /**
     * Mark the end of a request; the next {@link #acquire()} waits from here.
     */
    public void release() {
        lastReleaseNanos = nanoClock.getAsLong();
        released = true;
    }
}

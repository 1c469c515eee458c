package com.example.acgarden.utils;

import com.example.acgarden.exception.NetworkException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private final AtomicLong now = new AtomicLong();
    private final List<Long> sleeps = new ArrayList<>();

    private RateLimiter limiter(Duration interval) {
        return new RateLimiter(interval, now::get, millis -> {
            sleeps.add(millis);
            now.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
        });
    }

    @Test
    void firstAcquireDoesNotWait() {
        RateLimiter limiter = limiter(Duration.ofMillis(1500));

        limiter.acquire();

        assertThat(sleeps).isEmpty();
    }

    @Test
    void waitsForRemainderOfInterval() {
        RateLimiter limiter = limiter(Duration.ofMillis(1500));
        limiter.acquire();
        limiter.release();
        now.addAndGet(TimeUnit.MILLISECONDS.toNanos(400));

        limiter.acquire();

        assertThat(sleeps).containsExactly(1100L);
    }

    @Test
    void noWaitWhenIntervalAlreadyElapsed() {
        RateLimiter limiter = limiter(Duration.ofMillis(1500));
        limiter.release();
        now.addAndGet(TimeUnit.MILLISECONDS.toNanos(2000));

        limiter.acquire();

        assertThat(sleeps).isEmpty();
    }

    @Test
    void spanOfConsecutiveRequestsRespectsFloor() {
        RateLimiter limiter = limiter(Duration.ofMillis(1500));
        long start = now.get();
        int requests = 5;

        for (int i = 0; i < requests; i++) {
            limiter.acquire();
            limiter.release();
        }

        assertThat(now.get() - start).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(1500L * (requests - 1)));
    }

    @Test
    void realClockHonoursInterval() {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(40));
        long start = System.nanoTime();

        for (int i = 0; i < 4; i++) {
            limiter.acquire();
            limiter.release();
        }

        assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(120));
    }

    @Test
    void interruptedWaitSurfacesAsNetworkException() {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(1500), now::get, millis -> {
            throw new InterruptedException("stop");
        });
        limiter.release();

        try {
            assertThatThrownBy(limiter::acquire).isInstanceOf(NetworkException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsNegativeInterval() {
        assertThatThrownBy(() -> new RateLimiter(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

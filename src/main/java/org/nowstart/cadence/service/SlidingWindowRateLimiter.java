package org.nowstart.cadence.service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * At most {@code maxCalls} acquisitions per sliding {@code window}. Once the budget is used up,
 * {@link #acquire()} sleeps, in whole milliseconds, until the oldest call leaves the window.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    private final int maxCalls;
    private final long windowNanos;
    private final LongSupplier nanoTime;
    private final Sleeper sleeper;
    private final Deque<Long> calls = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxCalls, Duration window) {
        this(maxCalls, window, System::nanoTime, duration -> Thread.sleep(duration.toMillis()));
    }

    SlidingWindowRateLimiter(int maxCalls, Duration window, LongSupplier nanoTime, Sleeper sleeper) {
        if (maxCalls <= 0) {
            throw new IllegalArgumentException("maxCalls must be > 0");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxCalls = maxCalls;
        this.windowNanos = window.toNanos();
        this.nanoTime = nanoTime;
        this.sleeper = sleeper;
    }

    public synchronized void acquire() {
        long now = nanoTime.getAsLong();
        evictExpired(now);
        while (calls.size() >= maxCalls) {
            Duration wait = ceilToMillis(windowNanos - (now - calls.peekFirst()));
            log.info("Rate limit reached, sleeping. wait_ms={}", wait.toMillis());
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for rate limit", e);
            }
            now = nanoTime.getAsLong();
            evictExpired(now);
        }
        calls.addLast(now);
    }

    synchronized int inWindow() {
        evictExpired(nanoTime.getAsLong());
        return calls.size();
    }

    private static Duration ceilToMillis(long nanos) {
        return Duration.ofMillis(Math.max(1L, (nanos + 999_999L) / 1_000_000L));
    }

    private void evictExpired(long now) {
        while (!calls.isEmpty() && now - calls.peekFirst() >= windowNanos) {
            calls.removeFirst();
        }
    }

    @FunctionalInterface
    interface Sleeper {

        void sleep(Duration duration) throws InterruptedException;
    }
}

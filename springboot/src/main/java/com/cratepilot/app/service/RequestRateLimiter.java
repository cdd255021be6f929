package com.cratepilot.app.service;

import com.cratepilot.app.exception.MetadataSourceException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes outbound requests to one metadata source. Enforces a minimum spacing derived from the
 * per-second quota and a sliding 60-second window for the per-minute quota. Callers over quota wait;
 * nothing is dropped. A back-off requested by the source holds every caller until it expires.
 */
@Slf4j
public class RequestRateLimiter {

    private static final long WINDOW_MS = 60_000L;

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Long> window = new ArrayDeque<>();
    private final long minIntervalMs;
    private final int requestsPerMinute;
    private final Clock clock;
    private final Sleeper sleeper;

    private long lastRequestAt = -1;
    private long blockedUntil = -1;
    private long requestCount;

    public RequestRateLimiter(int requestsPerSecond, int requestsPerMinute) {
        this(requestsPerSecond, requestsPerMinute, Clock.systemUTC(), duration -> Thread.sleep(duration.toMillis()));
    }

    public RequestRateLimiter(int requestsPerSecond, int requestsPerMinute, Clock clock, Sleeper sleeper) {
        if (requestsPerSecond <= 0 || requestsPerMinute <= 0) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
        this.minIntervalMs = (long) Math.ceil(1000.0 / requestsPerSecond);
        this.requestsPerMinute = requestsPerMinute;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until one more request fits both quotas, then records it.
     */
    public void acquire() {
        lock.lock();
        try {
            long now = clock.millis();
            if (blockedUntil > now) {
                log.debug("Source asked to back off, waiting {} ms", blockedUntil - now);
                pause(blockedUntil - now);
                now = clock.millis();
            }
            if (lastRequestAt >= 0) {
                long wait = lastRequestAt + minIntervalMs - now;
                if (wait > 0) {
                    pause(wait);
                    now = clock.millis();
                }
            }

            evictBefore(now - WINDOW_MS);
            if (window.size() >= requestsPerMinute) {
                long wait = window.peekFirst() + WINDOW_MS - now;
                if (wait > 0) {
                    log.debug("Per-minute quota of {} reached, waiting {} ms", requestsPerMinute, wait);
                    pause(wait);
                    now = clock.millis();
                }
                evictBefore(now - WINDOW_MS);
            }

            window.addLast(now);
            lastRequestAt = now;
            requestCount++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Holds the next {@link #acquire()} until {@code delay} has passed. Overlapping back-offs keep the later end.
     */
    public void backOff(Duration delay) {
        lock.lock();
        try {
            blockedUntil = Math.max(blockedUntil, clock.millis() + delay.toMillis());
        } finally {
            lock.unlock();
        }
    }

    public long getRequestCount() {
        lock.lock();
        try {
            return requestCount;
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            requestCount = 0;
            lastRequestAt = -1;
            blockedUntil = -1;
            window.clear();
        } finally {
            lock.unlock();
        }
    }

    private void evictBefore(long cutoff) {
        while (!window.isEmpty() && window.peekFirst() <= cutoff) {
            window.pollFirst();
        }
    }

    private void pause(long millis) {
        try {
            sleeper.sleep(Duration.ofMillis(millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw MetadataSourceException.interrupted("rate limiter wait", e);
        }
    }
}

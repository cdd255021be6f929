package com.cratepilot.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cratepilot.app.exception.MetadataSourceException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RequestRateLimiterTest {

    /** Clock that only moves when the limiter sleeps. */
    private static final class ManualClock extends Clock {
        private long millis;

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }

        void advance(long delta) {
            millis += delta;
        }
    }

    private final ManualClock clock = new ManualClock();
    private final List<Long> sleeps = new ArrayList<>();

    private RequestRateLimiter limiter(int perSecond, int perMinute) {
        return new RequestRateLimiter(perSecond, perMinute, clock, duration -> {
            sleeps.add(duration.toMillis());
            clock.advance(duration.toMillis());
        });
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("First request goes through without waiting")
    void firstRequestImmediate() {
        RequestRateLimiter limiter = limiter(10, 100);

        limiter.acquire();

        assertThat(sleeps).isEmpty();
        assertThat(limiter.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Back-to-back requests are spaced by the per-second interval")
    void perSecondSpacing() {
        RequestRateLimiter limiter = limiter(3, 100);

        limiter.acquire();
        limiter.acquire();
        clock.advance(1000);
        limiter.acquire();

        // ceil(1000 / 3)
        assertThat(sleeps).containsExactly(334L);
    }

    @Test
    @DisplayName("Request over the per-minute quota waits for the window to slide")
    void perMinuteWindow() {
        RequestRateLimiter limiter = limiter(2, 3);

        for (int i = 0; i < 4; i++) {
            limiter.acquire();
        }

        assertThat(sleeps).containsExactly(500L, 500L, 500L, 58_500L);
        assertThat(clock.millis()).isEqualTo(60_000L);
        assertThat(limiter.getRequestCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Reset clears the counter and the window")
    void reset() {
        RequestRateLimiter limiter = limiter(1, 1);
        limiter.acquire();

        limiter.reset();
        limiter.acquire();

        assertThat(sleeps).isEmpty();
        assertThat(limiter.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Interrupted wait becomes a non-retryable source failure with the interrupt flag kept")
    void interrupted() {
        RequestRateLimiter limiter = new RequestRateLimiter(1, 10, clock, duration -> {
            throw new InterruptedException("stop");
        });
        limiter.acquire();

        assertThatThrownBy(limiter::acquire)
                .isInstanceOfSatisfying(MetadataSourceException.class, e -> assertThat(e.isRetryable()).isFalse());
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    @DisplayName("Back-off holds the next request and the later of two back-offs wins")
    void backOff() {
        RequestRateLimiter limiter = limiter(10, 100);
        limiter.acquire();
        clock.advance(1_000);

        limiter.backOff(Duration.ofSeconds(5));
        limiter.backOff(Duration.ofSeconds(2));
        limiter.acquire();
        limiter.acquire();

        assertThat(sleeps).containsExactly(5_000L, 100L);
    }

    @Test
    @DisplayName("Non-positive quotas are rejected")
    void invalidQuota() {
        assertThatThrownBy(() -> new RequestRateLimiter(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> limiter(5, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Durations passed to the sleeper are whole milliseconds")
    void sleeperReceivesDuration() {
        List<Duration> seen = new ArrayList<>();
        RequestRateLimiter limiter = new RequestRateLimiter(4, 100, clock, duration -> {
            seen.add(duration);
            clock.advance(duration.toMillis());
        });

        limiter.acquire();
        limiter.acquire();

        assertThat(seen).containsExactly(Duration.ofMillis(250));
    }
}

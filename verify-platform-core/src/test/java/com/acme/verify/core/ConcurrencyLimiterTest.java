package com.acme.verify.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ConcurrencyLimiterTest {

    @Test
    @DisplayName("Should hand out at most limit permits")
    void testTryAcquireStopsAtLimit() {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("worker", 2);

        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();
        assertThat(limiter.inFlight()).isEqualTo(2);
        assertThat(limiter.available()).isZero();
    }

    @Test
    @DisplayName("Should make a released permit available again and keep the peak")
    void testReleaseAndPeak() {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("worker", 3);
        limiter.tryAcquire();
        limiter.tryAcquire();
        limiter.release();
        limiter.release();

        assertThat(limiter.inFlight()).isZero();
        assertThat(limiter.available()).isEqualTo(3);
        assertThat(limiter.peakInFlight()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should throw OverloadedException when no permit frees up in time")
    void testAcquireTimesOut() {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("renderer", 1);
        limiter.acquire(Duration.ofMillis(10));

        assertThatThrownBy(() -> limiter.acquire(Duration.ofMillis(20)))
                .isInstanceOf(OverloadedException.class)
                .hasMessageContaining("renderer concurrency ceiling of 1 reached");
        assertThat(limiter.inFlight()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a limit below one")
    void testRejectsZeroLimit() {
        assertThatThrownBy(() -> new ConcurrencyLimiter("worker", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 1");
    }
}

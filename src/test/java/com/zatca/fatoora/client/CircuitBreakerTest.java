package com.zatca.fatoora.client;

import com.zatca.fatoora.exception.NetworkException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CircuitBreaker
 */
class CircuitBreakerTest {

    private SteppingClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new SteppingClock(Instant.parse("2024-01-15T10:30:00Z"));
        breaker = new CircuitBreaker(3, Duration.ofSeconds(30), 2, clock);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breaker.recordFailure();
        }
    }

    @Test
    @DisplayName("should open after consecutive failures and refuse calls with NET05")
    void shouldOpenAfterThreshold() {
        fail(2);
        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
        breaker.acquirePermission();

        breaker.recordFailure();

        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        NetworkException e = assertThrows(NetworkException.class, breaker::acquirePermission);
        assertEquals("NET05", e.getNetworkCode());
        assertTrue(e.getMessage().contains("30 seconds"));
    }

    @Test
    @DisplayName("should reset the failure count on success")
    void shouldResetOnSuccess() {
        fail(2);
        breaker.recordSuccess();
        fail(2);

        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    @DisplayName("should close after enough successes once the recovery timeout passed")
    void shouldRecover() {
        fail(3);
        clock.advance(Duration.ofSeconds(30));

        breaker.acquirePermission();
        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.getState());
        breaker.recordSuccess();
        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.getState());
        breaker.recordSuccess();

        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    @DisplayName("should reopen on a failure while half-open")
    void shouldReopenFromHalfOpen() {
        fail(3);
        clock.advance(Duration.ofSeconds(31));
        breaker.acquirePermission();

        breaker.recordFailure();

        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        assertThrows(NetworkException.class, breaker::acquirePermission);
    }

    @Test
    @DisplayName("should reject thresholds below one")
    void shouldRejectInvalidThresholds() {
        assertThrows(IllegalArgumentException.class,
            () -> new CircuitBreaker(0, Duration.ofSeconds(1), 1, clock));
    }

    private static final class SteppingClock extends Clock {
        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

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
            return now;
        }
    }
}

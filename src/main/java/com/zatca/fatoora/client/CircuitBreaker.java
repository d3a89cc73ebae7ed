package com.zatca.fatoora.client;

import com.zatca.fatoora.exception.NetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Stops calling the regulator after repeated server or transport failures.
 *
 * <p>{@code failureThreshold} consecutive failures open the breaker; calls
 * are refused with {@code NET05} until {@code recoveryTimeout} has passed.
 * The breaker then lets calls through on probation and closes again after
 * {@code successThreshold} successes, or reopens on the first failure.
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int successThreshold;
    private final Clock clock;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private int probationSuccesses;
    private long openedAtMillis;

    public CircuitBreaker(int failureThreshold, Duration recoveryTimeout, int successThreshold, Clock clock) {
        if (failureThreshold < 1 || successThreshold < 1) {
            throw new IllegalArgumentException("Circuit breaker thresholds must be at least 1");
        }
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.successThreshold = successThreshold;
        this.clock = clock;
    }

    /** 5 failures, 30 second recovery, 3 successes to close */
    public static CircuitBreaker withDefaults() {
        return new CircuitBreaker(5, Duration.ofSeconds(30), 3, Clock.systemUTC());
    }

    /**
     * @throws NetworkException with code NET05 while the breaker is open
     */
    public synchronized void acquirePermission() {
        if (state != State.OPEN) {
            return;
        }
        long remaining = recoveryTimeout.toMillis() - (clock.millis() - openedAtMillis);
        if (remaining > 0) {
            throw NetworkException.circuitBreakerOpen((int) Math.ceil(remaining / 1000.0));
        }
        state = State.HALF_OPEN;
        probationSuccesses = 0;
        logger.info("Circuit breaker half-open, letting calls through on probation");
    }

    public synchronized void recordSuccess() {
        if (state == State.HALF_OPEN && ++probationSuccesses >= successThreshold) {
            state = State.CLOSED;
            logger.info("Circuit breaker closed after {} successful calls", probationSuccesses);
        }
        if (state == State.CLOSED) {
            consecutiveFailures = 0;
        }
    }

    public synchronized void recordFailure() {
        if (state == State.HALF_OPEN) {
            open();
            logger.warn("Circuit breaker reopened by a failure on probation");
        } else if (state == State.CLOSED && ++consecutiveFailures >= failureThreshold) {
            open();
            logger.warn("Circuit breaker opened after {} consecutive failures", consecutiveFailures);
        }
    }

    public synchronized State getState() {
        return state;
    }

    private void open() {
        state = State.OPEN;
        openedAtMillis = clock.millis();
        consecutiveFailures = 0;
    }
}

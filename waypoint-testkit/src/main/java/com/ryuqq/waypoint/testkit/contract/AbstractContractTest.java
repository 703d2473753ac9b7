package com.ryuqq.waypoint.testkit.contract;

import com.ryuqq.waypoint.core.protection.CircuitBreaker;
import com.ryuqq.waypoint.core.protection.CircuitBreakerState;
import com.ryuqq.waypoint.testkit.fixture.MutableClock;
import com.ryuqq.waypoint.testkit.fixture.RecordingSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>This class provides a controllable clock and a sleeper that records backoff delays
 * instead of blocking, so that time-dependent contracts run deterministically.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>MutableClock: Time source that only moves when a test advances it</li>
 *   <li>RecordingSleeper: Records requested delays and advances the clock by the same amount</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyCircuitBreakerContractTest extends CircuitBreakerContract {
 *     {@literal @}Override
 *     protected CircuitBreaker createCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
 *         return new MyCircuitBreaker(name, config, clock);
 *     }
 * }
 * </pre>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected MutableClock clock;
    protected RecordingSleeper sleeper;

    /**
     * Creates fresh time fixtures before each test.
     */
    @BeforeEach
    void setUpTimeFixtures() {
        clock = MutableClock.create();
        sleeper = new RecordingSleeper(clock);
    }

    @AfterEach
    void clearTimeFixtures() {
        if (sleeper != null) {
            sleeper.clear();
        }
    }

    /**
     * A failure the default classifier treats as transient (retryable).
     *
     * @return a new IOException
     */
    protected Exception transientFailure() {
        return new IOException("connection reset by peer");
    }

    /**
     * A failure the default classifier treats as a validation error (not retryable).
     *
     * @return a new IllegalArgumentException
     */
    protected Exception validationFailure() {
        return new IllegalArgumentException("invalid input");
    }

    /**
     * Drives the breaker through {@code times} failed calls.
     *
     * @param breaker the circuit breaker
     * @param times number of failures to record
     */
    protected void failTimes(CircuitBreaker breaker, int times) {
        for (int i = 0; i < times; i++) {
            try {
                breaker.call(() -> {
                    throw transientFailure();
                });
            } catch (Exception expected) {
                // failure is the point
            }
        }
    }

    /**
     * Asserts that the breaker is in the expected state.
     *
     * @param breaker the circuit breaker
     * @param expected the expected state
     */
    protected void assertCircuitState(CircuitBreaker breaker, CircuitBreakerState expected) {
        CircuitBreakerState actual = breaker.getState();
        assertEquals(expected, actual,
            String.format("Expected circuit '%s' to be %s but was %s", breaker.getName(), expected, actual));
    }
}

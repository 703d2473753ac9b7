package com.ryuqq.waypoint.testkit.contract;

import com.ryuqq.waypoint.core.exception.CircuitOpenException;
import com.ryuqq.waypoint.core.protection.CircuitBreaker;
import com.ryuqq.waypoint.core.protection.CircuitBreakerConfig;
import com.ryuqq.waypoint.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.waypoint.core.protection.CircuitBreakerState;
import com.ryuqq.waypoint.testkit.fixture.ScriptedOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link CircuitBreaker} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN after {@code failureThreshold} consecutive failures</li>
 *   <li>OPEN rejects without invoking the operation until {@code recoveryTimeout} elapses</li>
 *   <li>HALF_OPEN → CLOSED after {@code successThreshold} successes, HALF_OPEN → OPEN on any failure</li>
 *   <li>A success in CLOSED clears the consecutive failure count</li>
 *   <li>reset() returns to CLOSED with zeroed counters</li>
 * </ul>
 *
 * <p>Configuration used: failureThreshold=3, recoveryTimeout=30s, successThreshold=2.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public abstract class CircuitBreakerContract extends AbstractContractTest {

    protected static final CircuitBreakerConfig CONFIG =
        new CircuitBreakerConfig(3, Duration.ofSeconds(30), 2);

    protected CircuitBreaker breaker;

    /**
     * Creates the implementation under test.
     *
     * @param name operation name
     * @param config breaker configuration
     * @param clock time source the breaker must use for recovery decisions
     * @return a new CLOSED breaker
     */
    protected abstract CircuitBreaker createCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock);

    @BeforeEach
    void createBreaker() {
        breaker = createCircuitBreaker("payment-api", CONFIG, clock);
    }

    @Test
    void testNewBreaker_IsClosedAndAdmitsCalls() throws Exception {
        // Given / When
        String result = breaker.call(() -> "ok");

        // Then
        assertEquals("ok", result);
        assertCircuitState(breaker, CircuitBreakerState.CLOSED);
        assertEquals(Duration.ZERO, breaker.getRetryAfter());
    }

    @Test
    void testFailuresBelowThreshold_StayClosed() {
        // When
        failTimes(breaker, CONFIG.failureThreshold() - 1);

        // Then
        assertCircuitState(breaker, CircuitBreakerState.CLOSED);
        assertEquals(2, breaker.snapshot().failureCount());
    }

    @Test
    void testFailureThresholdReached_OpensCircuit() {
        // When
        failTimes(breaker, CONFIG.failureThreshold());

        // Then
        assertCircuitState(breaker, CircuitBreakerState.OPEN);
        assertNotNull(breaker.snapshot().openedAt(), "openedAt should be recorded");
    }

    @Test
    void testOpenCircuit_RejectsWithoutInvokingOperation() {
        // Given
        failTimes(breaker, CONFIG.failureThreshold());
        ScriptedOperation<String> operation = ScriptedOperation.returning("never");

        // When
        CircuitOpenException rejected = assertThrows(CircuitOpenException.class, () -> breaker.call(operation));

        // Then
        assertEquals(0, operation.invocations(), "OPEN circuit must not invoke the operation");
        assertEquals("payment-api", rejected.getOperationName());
        assertEquals(CONFIG.recoveryTimeout(), rejected.getRetryAfter());
        assertEquals(1, breaker.snapshot().totalRejected());
    }

    @Test
    void testOpenCircuit_StaysOpenUntilRecoveryTimeout() {
        // Given
        failTimes(breaker, CONFIG.failureThreshold());

        // When
        clock.advance(CONFIG.recoveryTimeout().minusSeconds(1));

        // Then
        assertCircuitState(breaker, CircuitBreakerState.OPEN);
        assertFalse(breaker.tryAcquire());
        assertEquals(Duration.ofSeconds(1), breaker.getRetryAfter());
    }

    @Test
    void testRecoveryTimeoutElapsed_MovesToHalfOpen() {
        // Given
        failTimes(breaker, CONFIG.failureThreshold());

        // When
        clock.advance(CONFIG.recoveryTimeout());

        // Then
        assertCircuitState(breaker, CircuitBreakerState.HALF_OPEN);
        assertTrue(breaker.tryAcquire(), "HALF_OPEN should admit trial calls");
    }

    @Test
    void testHalfOpen_SuccessThresholdClosesAndResetsCounters() throws Exception {
        // Given
        failTimes(breaker, CONFIG.failureThreshold());
        clock.advance(CONFIG.recoveryTimeout());

        // When
        breaker.call(() -> "trial-1");
        assertCircuitState(breaker, CircuitBreakerState.HALF_OPEN);
        breaker.call(() -> "trial-2");

        // Then
        assertCircuitState(breaker, CircuitBreakerState.CLOSED);
        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        assertEquals(0, snapshot.failureCount());
        assertEquals(0, snapshot.successCount());
    }

    @Test
    void testHalfOpen_AnyFailureReopens() {
        // Given
        failTimes(breaker, CONFIG.failureThreshold());
        clock.advance(CONFIG.recoveryTimeout());

        // When
        failTimes(breaker, 1);

        // Then
        assertCircuitState(breaker, CircuitBreakerState.OPEN);
        assertEquals(CONFIG.recoveryTimeout(), breaker.getRetryAfter(), "reopening restarts the recovery timer");
    }

    @Test
    void testClosed_SuccessClearsConsecutiveFailures() throws Exception {
        // Given
        failTimes(breaker, CONFIG.failureThreshold() - 1);

        // When
        breaker.call(() -> "ok");
        failTimes(breaker, CONFIG.failureThreshold() - 1);

        // Then
        assertCircuitState(breaker, CircuitBreakerState.CLOSED);
    }

    @Test
    void testFailingCall_RethrowsOriginalException() {
        // Given
        Exception failure = transientFailure();

        // When
        Exception thrown = assertThrows(Exception.class, () -> breaker.call(() -> {
            throw failure;
        }));

        // Then
        assertSame(failure, thrown);
    }

    @Test
    void testSnapshot_CountsCallsFailuresAndRejections() throws Exception {
        // Given
        breaker.call(() -> "ok");
        failTimes(breaker, CONFIG.failureThreshold());
        assertFalse(breaker.tryAcquire());

        // When
        CircuitBreakerSnapshot snapshot = breaker.snapshot();

        // Then
        assertEquals("payment-api", snapshot.operationName());
        assertEquals(4, snapshot.totalCalls());
        assertEquals(1, snapshot.totalSuccesses());
        assertEquals(3, snapshot.totalFailures());
        assertEquals(1, snapshot.totalRejected());
        assertNotNull(snapshot.lastFailureTime());
    }

    @Test
    void testReset_ReturnsToClosedWithZeroedCounters() {
        // Given
        failTimes(breaker, CONFIG.failureThreshold());

        // When
        breaker.reset();

        // Then
        assertCircuitState(breaker, CircuitBreakerState.CLOSED);
        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        assertEquals(0, snapshot.failureCount());
        assertEquals(0, snapshot.totalCalls());
        assertEquals(0, snapshot.totalFailures());
        assertNull(snapshot.openedAt());
    }
}

package com.ryuqq.waypoint.testkit.contract;

import com.ryuqq.waypoint.application.resilience.ResilienceConfig;
import com.ryuqq.waypoint.application.resilience.ResilienceMetricsSnapshot;
import com.ryuqq.waypoint.application.resilience.ResilienceOrchestrator;
import com.ryuqq.waypoint.application.resilience.ResilienceResult;
import com.ryuqq.waypoint.core.exception.BulkheadFullException;
import com.ryuqq.waypoint.core.exception.CircuitOpenException;
import com.ryuqq.waypoint.core.exception.OperationTimeoutException;
import com.ryuqq.waypoint.core.exception.ResilienceException;
import com.ryuqq.waypoint.core.protection.BulkheadConfig;
import com.ryuqq.waypoint.core.protection.CircuitBreakerConfig;
import com.ryuqq.waypoint.core.protection.CircuitBreakerState;
import com.ryuqq.waypoint.core.retry.ErrorCategory;
import com.ryuqq.waypoint.core.retry.RetryPolicy;
import com.ryuqq.waypoint.core.spi.Sleeper;
import com.ryuqq.waypoint.testkit.fixture.ScriptedOperation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link ResilienceOrchestrator} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Retry: transient failures are retried with the policy's delays, validation failures are not</li>
 *   <li>Circuit Breaker: consecutive failures open the circuit, an OPEN circuit short-circuits the retry loop</li>
 *   <li>Bulkhead: a saturated bulkhead rejects immediately, with or without fallback</li>
 *   <li>Timeout: a slow attempt fails with {@link OperationTimeoutException} and counts as a breaker failure</li>
 *   <li>Fallback: used on final failure, its own failure is reported</li>
 *   <li>Metrics: one call record per execute, retry statistics per retry loop</li>
 * </ul>
 *
 * <p>Backoff delays go through {@link #sleeper}, so no test actually waits for a retry.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public abstract class ResilienceOrchestratorContract extends AbstractContractTest {

    protected static final Duration FIXED_DELAY = Duration.ofMillis(100);

    private final List<ResilienceOrchestrator> created = new ArrayList<>();

    /**
     * Creates the implementation under test.
     *
     * @param config resilience configuration
     * @param sleeper sleeper to use for backoff delays
     * @param clock time source for circuit breakers
     * @return a new orchestrator with its own breakers and metrics
     */
    protected abstract ResilienceOrchestrator createOrchestrator(ResilienceConfig config, Sleeper sleeper, Clock clock);

    /**
     * Releases resources held by an orchestrator created in a test.
     *
     * @param orchestrator the orchestrator
     * @throws Exception if shutdown fails
     */
    protected void release(ResilienceOrchestrator orchestrator) throws Exception {
    }

    @AfterEach
    void releaseOrchestrators() throws Exception {
        for (ResilienceOrchestrator orchestrator : created) {
            release(orchestrator);
        }
        created.clear();
    }

    /**
     * Base configuration: fixed 100ms delays, 5 attempts, breaker threshold 3, no timeout, no bulkhead.
     */
    protected ResilienceConfig baseConfig() {
        return new ResilienceConfig()
            .withRetryPolicy(RetryPolicy.fixed(5, FIXED_DELAY))
            .withCircuitBreaker(new CircuitBreakerConfig(3, Duration.ofSeconds(30), 2))
            .withTimeout(Duration.ZERO);
    }

    protected ResilienceOrchestrator orchestrator(ResilienceConfig config) {
        ResilienceOrchestrator orchestrator = createOrchestrator(config, sleeper, clock);
        created.add(orchestrator);
        return orchestrator;
    }

    // ===================================================================
    // RETRY
    // ===================================================================

    @Test
    void testImmediateSuccess_SingleAttemptNoSleep() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig());

        // When
        ResilienceResult<String> result = orchestrator.execute(ScriptedOperation.returning("ok"), "lookup");

        // Then
        assertEquals("ok", result.result());
        assertEquals(1, result.attempts());
        assertFalse(result.usedFallback());
        assertEquals(0, sleeper.count());

        ResilienceMetricsSnapshot metrics = orchestrator.getMetrics();
        assertEquals(1, metrics.totalCalls());
        assertEquals(1, metrics.successfulCalls());
        assertEquals(1, metrics.immediateSuccesses());
        assertEquals(0, metrics.retriedCalls());
    }

    @Test
    void testTransientFailures_RetriedWithFixedDelays() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig());
        ScriptedOperation<String> operation = ScriptedOperation.<String>script()
            .thenThrowTimes(2, transientFailure())
            .thenReturn("ok");

        // When
        ResilienceResult<String> result = orchestrator.execute(operation, "fetch");

        // Then
        assertEquals("ok", result.result());
        assertEquals(3, result.attempts());
        assertEquals(List.of(FIXED_DELAY, FIXED_DELAY), sleeper.getSleeps());

        ResilienceMetricsSnapshot metrics = orchestrator.getMetrics();
        assertEquals(1, metrics.retriedCalls());
        assertEquals(1, metrics.successesAfterRetry());
        assertEquals(3, metrics.totalAttempts());
        assertEquals(FIXED_DELAY.multipliedBy(2), metrics.totalDelay());
        assertEquals(FIXED_DELAY, metrics.maxDelay());
    }

    @Test
    void testValidationFailure_NotRetried() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig());
        Exception failure = validationFailure();
        ScriptedOperation<String> operation = ScriptedOperation.failing(failure);

        // When
        ResilienceException thrown = assertThrows(ResilienceException.class,
            () -> orchestrator.execute(operation, "validate"));

        // Then
        assertEquals(1, operation.invocations());
        assertEquals(1, thrown.getAttempts());
        assertSame(failure, thrown.getCause());
        assertEquals(0, sleeper.count());
        assertEquals(1L, orchestrator.getMetrics().errorCategories().get(ErrorCategory.VALIDATION));
    }

    @Test
    void testRetriesExhausted_ThrowsWithAttemptCount() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig()
            .withRetryPolicy(RetryPolicy.fixed(2, FIXED_DELAY))
            .withCircuitBreakerEnabled(false));
        ScriptedOperation<String> operation = ScriptedOperation.failing(transientFailure());

        // When
        ResilienceException thrown = assertThrows(ResilienceException.class,
            () -> orchestrator.execute(operation, "fetch"));

        // Then
        assertEquals(2, thrown.getAttempts());
        assertEquals(2, operation.invocations());
        assertInstanceOf(IOException.class, thrown.getCause());
        assertEquals(1, orchestrator.getMetrics().failedCalls());
        assertEquals(1L, orchestrator.getMetrics().errorCategories().get(ErrorCategory.TRANSIENT));
    }

    @Test
    void testRetryDisabled_SingleAttempt() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig().withRetryEnabled(false));
        ScriptedOperation<String> operation = ScriptedOperation.failing(transientFailure());

        // When
        ResilienceException thrown = assertThrows(ResilienceException.class,
            () -> orchestrator.execute(operation, "fetch"));

        // Then
        assertEquals(1, thrown.getAttempts());
        assertEquals(0, sleeper.count());
    }

    // ===================================================================
    // CIRCUIT BREAKER
    // ===================================================================

    @Test
    void testConsecutiveFailures_OpenCircuitAndShortCircuitRetry() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig());
        ScriptedOperation<String> operation = ScriptedOperation.failing(transientFailure());

        // When: 3rd failure opens the breaker, the 4th attempt is rejected and not retried
        CircuitOpenException thrown = assertThrows(CircuitOpenException.class,
            () -> orchestrator.execute(operation, "flaky-api"));

        // Then
        assertEquals(3, operation.invocations());
        assertEquals("flaky-api", thrown.getOperationName());
        assertEquals(CircuitBreakerState.OPEN, orchestrator.getCircuitState("flaky-api"));
        assertEquals(1, orchestrator.getMetrics().circuitOpenCount());
    }

    @Test
    void testOpenCircuit_RejectsWithoutInvoking() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig().withRetryEnabled(false));
        ScriptedOperation<String> failing = ScriptedOperation.failing(transientFailure());
        for (int i = 0; i < 3; i++) {
            assertThrows(ResilienceException.class, () -> orchestrator.execute(failing, "flaky-api"));
        }
        ScriptedOperation<String> healthy = ScriptedOperation.returning("ok");

        // When
        assertThrows(CircuitOpenException.class, () -> orchestrator.execute(healthy, "flaky-api"));

        // Then
        assertEquals(0, healthy.invocations());
        assertEquals(3, orchestrator.getCircuitSnapshot("flaky-api").orElseThrow().totalFailures());
    }

    @Test
    void testOpenCircuitRejections_TalliedApartFromOperationFailures() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig().withRetryEnabled(false));
        ScriptedOperation<String> failing = ScriptedOperation.failing(transientFailure());
        for (int i = 0; i < 3; i++) {
            assertThrows(ResilienceException.class, () -> orchestrator.execute(failing, "flaky-api"));
        }

        // When
        for (int i = 0; i < 2; i++) {
            assertThrows(CircuitOpenException.class, () -> orchestrator.execute(failing, "flaky-api"));
        }

        // Then
        ResilienceMetricsSnapshot metrics = orchestrator.getMetrics();
        assertEquals(5, metrics.totalCalls());
        assertEquals(3, metrics.failedCalls());
        assertEquals(2, metrics.circuitOpenCount());
        assertEquals(1, metrics.errorCategories().size());
        assertEquals(3L, metrics.errorCategories().get(ErrorCategory.TRANSIENT));
    }

    @Test
    void testOpenCircuit_RecoversAfterTimeout() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig().withRetryEnabled(false));
        ScriptedOperation<String> failing = ScriptedOperation.failing(transientFailure());
        for (int i = 0; i < 3; i++) {
            assertThrows(ResilienceException.class, () -> orchestrator.execute(failing, "flaky-api"));
        }

        // When
        clock.advance(Duration.ofSeconds(30));
        orchestrator.execute(ScriptedOperation.returning("a"), "flaky-api");
        orchestrator.execute(ScriptedOperation.returning("b"), "flaky-api");

        // Then
        assertEquals(CircuitBreakerState.CLOSED, orchestrator.getCircuitState("flaky-api"));
    }

    @Test
    void testCircuitsAreIsolatedPerOperationName() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig().withRetryEnabled(false));
        ScriptedOperation<String> failing = ScriptedOperation.failing(transientFailure());
        for (int i = 0; i < 3; i++) {
            assertThrows(ResilienceException.class, () -> orchestrator.execute(failing, "flaky-api"));
        }

        // When
        ResilienceResult<String> other = orchestrator.execute(ScriptedOperation.returning("ok"), "stable-api");

        // Then
        assertEquals("ok", other.result());
        assertEquals(CircuitBreakerState.OPEN, orchestrator.getCircuitState("flaky-api"));
        assertEquals(CircuitBreakerState.CLOSED, orchestrator.getCircuitState("stable-api"));
    }

    @Test
    void testResetCircuit_ClosesOpenCircuit() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig().withRetryEnabled(false));
        ScriptedOperation<String> failing = ScriptedOperation.failing(transientFailure());
        for (int i = 0; i < 3; i++) {
            assertThrows(ResilienceException.class, () -> orchestrator.execute(failing, "flaky-api"));
        }

        // When
        orchestrator.resetCircuit("flaky-api");

        // Then
        assertEquals(CircuitBreakerState.CLOSED, orchestrator.getCircuitState("flaky-api"));
        assertEquals("ok", orchestrator.execute(ScriptedOperation.returning("ok"), "flaky-api").result());
    }

    @Test
    void testUnknownCircuit_ReportsClosed() {
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig());

        assertEquals(CircuitBreakerState.CLOSED, orchestrator.getCircuitState("never-called"));
        assertTrue(orchestrator.getCircuitSnapshot("never-called").isEmpty());
    }

    // ===================================================================
    // FALLBACK
    // ===================================================================

    @Test
    void testFinalFailure_UsesFallback() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig()
            .withRetryPolicy(RetryPolicy.fixed(2, FIXED_DELAY)));
        Exception failure = transientFailure();

        // When
        ResilienceResult<String> result = orchestrator.execute(
            ScriptedOperation.failing(failure), "report", cause -> "cached");

        // Then
        assertEquals("cached", result.result());
        assertTrue(result.usedFallback());
        assertEquals(2, result.attempts());
        assertSame(failure, result.fallbackCause());
        assertEquals(1, orchestrator.getMetrics().fallbackCalls());
    }

    @Test
    void testFallbackFailure_ReportedOnResilienceException() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig().withRetryEnabled(false));

        // When
        ResilienceException thrown = assertThrows(ResilienceException.class, () -> orchestrator.execute(
            ScriptedOperation.<String>failing(transientFailure()), "report",
            cause -> {
                throw new IllegalStateException("cache down");
            }));

        // Then
        assertTrue(thrown.isFallbackFailed());
        assertInstanceOf(IOException.class, thrown.getCause());
    }

    @Test
    void testFallbackDisabled_FallbackIgnored() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig()
            .withRetryEnabled(false)
            .withFallbackEnabled(false));

        // When / Then
        assertThrows(ResilienceException.class, () -> orchestrator.execute(
            ScriptedOperation.<String>failing(transientFailure()), "report", cause -> "cached"));
    }

    // ===================================================================
    // BULKHEAD
    // ===================================================================

    @Test
    void testSaturatedBulkhead_RejectsThirdCallImmediately() throws Exception {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig()
            .withBulkheadEnabled(true)
            .withBulkhead(new BulkheadConfig(2)));
        CountDownLatch entered = new CountDownLatch(2);
        CountDownLatch proceed = new CountDownLatch(1);
        ExecutorService callers = Executors.newFixedThreadPool(2);

        try {
            List<Future<ResilienceResult<String>>> inFlight = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                inFlight.add(callers.submit(() -> orchestrator.execute(() -> {
                    entered.countDown();
                    proceed.await(5, TimeUnit.SECONDS);
                    return "slow";
                }, "export")));
            }
            assertTrue(entered.await(5, TimeUnit.SECONDS), "both calls should hold a permit");

            // When
            ScriptedOperation<String> third = ScriptedOperation.returning("never");
            BulkheadFullException rejected = assertThrows(BulkheadFullException.class,
                () -> orchestrator.execute(third, "export"));
            ResilienceResult<String> degraded = orchestrator.execute(third, "export", cause -> "queued");

            // Then
            assertEquals(0, third.invocations());
            assertEquals(2, rejected.getMaxConcurrentCalls());
            assertTrue(degraded.usedFallback());
            assertEquals(0, degraded.attempts());
            assertInstanceOf(BulkheadFullException.class, degraded.fallbackCause());

            proceed.countDown();
            for (Future<ResilienceResult<String>> call : inFlight) {
                assertEquals("slow", call.get(5, TimeUnit.SECONDS).result());
            }
            assertEquals(2, orchestrator.getMetrics().bulkheadRejectedCount());
            assertEquals("ok", orchestrator.execute(ScriptedOperation.returning("ok"), "export").result(),
                "permits must be released after completion");
        } finally {
            proceed.countDown();
            callers.shutdownNow();
        }
    }

    // ===================================================================
    // TIMEOUT
    // ===================================================================

    @Test
    void testSlowAttempt_TimesOutAndCountsAsBreakerFailure() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig()
            .withRetryEnabled(false)
            .withTimeout(Duration.ofMillis(50)));
        CountDownLatch never = new CountDownLatch(1);

        try {
            // When
            ResilienceException thrown = assertThrows(ResilienceException.class,
                () -> orchestrator.execute(() -> {
                    never.await(5, TimeUnit.SECONDS);
                    return "late";
                }, "slow-api"));

            // Then
            OperationTimeoutException timeout = assertInstanceOf(OperationTimeoutException.class, thrown.getCause());
            assertEquals(Duration.ofMillis(50), timeout.getTimeout());
            assertEquals(1, orchestrator.getMetrics().timeoutCount());
            assertEquals(1, orchestrator.getCircuitSnapshot("slow-api").orElseThrow().totalFailures());
        } finally {
            never.countDown();
        }
    }

    @Test
    void testTimeout_IsRetryable() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig()
            .withRetryPolicy(RetryPolicy.fixed(2, FIXED_DELAY))
            .withTimeout(Duration.ofMillis(50)));
        CountDownLatch never = new CountDownLatch(1);
        ScriptedOperation<String> operation = ScriptedOperation.<String>script()
            .thenRun(() -> {
                never.await(5, TimeUnit.SECONDS);
                return "late";
            })
            .thenReturn("fast");

        try {
            // When
            ResilienceResult<String> result = orchestrator.execute(operation, "slow-api");

            // Then
            assertEquals("fast", result.result());
            assertEquals(2, result.attempts());
            assertEquals(1, orchestrator.getMetrics().timeoutCount());
        } finally {
            never.countDown();
        }
    }

    // ===================================================================
    // ARGUMENTS & METRICS
    // ===================================================================

    @Test
    void testBlankOperationName_Rejected() {
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig());

        assertThrows(IllegalArgumentException.class,
            () -> orchestrator.execute(ScriptedOperation.returning("ok"), " "));
    }

    @Test
    void testResetMetrics_ZeroesCounters() {
        // Given
        ResilienceOrchestrator orchestrator = orchestrator(baseConfig());
        orchestrator.execute(ScriptedOperation.returning("ok"), "lookup");

        // When
        orchestrator.resetMetrics();

        // Then
        ResilienceMetricsSnapshot metrics = orchestrator.getMetrics();
        assertEquals(0, metrics.totalCalls());
        assertEquals(0, metrics.totalAttempts());
        assertTrue(metrics.circuits().containsKey("lookup"), "breakers survive a metrics reset");
    }
}

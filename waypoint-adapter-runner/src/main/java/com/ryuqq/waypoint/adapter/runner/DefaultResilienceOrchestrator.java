package com.ryuqq.waypoint.adapter.runner;

import com.ryuqq.waypoint.adapter.inmemory.protection.BulkheadRegistry;
import com.ryuqq.waypoint.adapter.inmemory.protection.CircuitBreakerRegistry;
import com.ryuqq.waypoint.adapter.runner.ResilienceMetrics.CallOutcome;
import com.ryuqq.waypoint.application.resilience.ResilienceConfig;
import com.ryuqq.waypoint.application.resilience.ResilienceMetricsSnapshot;
import com.ryuqq.waypoint.application.resilience.ResilienceOrchestrator;
import com.ryuqq.waypoint.application.resilience.ResilienceResult;
import com.ryuqq.waypoint.core.exception.BulkheadFullException;
import com.ryuqq.waypoint.core.exception.CircuitOpenException;
import com.ryuqq.waypoint.core.exception.OperationTimeoutException;
import com.ryuqq.waypoint.core.exception.ResilienceException;
import com.ryuqq.waypoint.core.exception.WaypointException;
import com.ryuqq.waypoint.core.model.OperationName;
import com.ryuqq.waypoint.core.protection.Bulkhead;
import com.ryuqq.waypoint.core.protection.CircuitBreaker;
import com.ryuqq.waypoint.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.waypoint.core.protection.CircuitBreakerState;
import com.ryuqq.waypoint.core.protection.noop.NoOpBulkhead;
import com.ryuqq.waypoint.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.waypoint.core.retry.RetryResult;
import com.ryuqq.waypoint.core.spi.Fallback;
import com.ryuqq.waypoint.core.spi.Operation;
import com.ryuqq.waypoint.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ResilienceOrchestrator} 기본 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute(operation, name, fallback)
 *   ↓
 * 1. bulkhead.tryAcquire()         → 실패: fallback 또는 BulkheadFullException
 *   ↓
 * 2. retryManager.execute(...)      → 매 시도:
 *      breaker.call(                → OPEN: CircuitOpenException (재시도 안 함)
 *        deadline race(operation)   → 초과: OperationTimeoutException (재시도 대상)
 *      )
 *   ↓
 * 3. 성공 → ResilienceResult.of
 *    실패 → fallback 또는 ResilienceException / CircuitOpenException
 *   ↓
 * 4. finally: bulkhead.release(), metrics.recordCall() 1회
 * </pre>
 *
 * <p><strong>시도별 제한 시간:</strong></p>
 * <ul>
 *   <li>Operation은 별도 스레드에서 실행되고 호출 스레드는 제한 시간까지만 기다립니다</li>
 *   <li>제한 시간 초과는 Circuit Breaker 실패로 기록되며, 늦게 도착한 결과는 버려집니다</li>
 *   <li>Operation을 강제로 중단하지 않습니다</li>
 * </ul>
 *
 * <p>Circuit Breaker 레지스트리, Bulkhead 레지스트리, 메트릭은 이 인스턴스의 필드입니다.
 * 인스턴스를 여러 개 만들면 서로 독립적으로 동작합니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class DefaultResilienceOrchestrator implements ResilienceOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultResilienceOrchestrator.class);
    private static final Bulkhead NO_OP_BULKHEAD = new NoOpBulkhead();

    private final ResilienceConfig config;
    private final CircuitBreakerRegistry circuitBreakers;
    private final BulkheadRegistry bulkheads;
    private final ResilienceMetrics metrics;
    private final RetryManager retryManager;
    private final ExecutorService attemptExecutor;

    /**
     * 기본 구성으로 생성 (실제 sleep, 시스템 시계).
     *
     * @param config 설정
     */
    public DefaultResilienceOrchestrator(ResilienceConfig config) {
        this(config, Sleeper.system(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param sleeper 백오프 대기 수단
     * @param clock Circuit Breaker와 재시도 이력의 시각 공급자
     */
    public DefaultResilienceOrchestrator(ResilienceConfig config, Sleeper sleeper, Clock clock) {
        this(config, sleeper, clock, new BackoffCalculator(), Executors.newCachedThreadPool(attemptThreadFactory()));
    }

    /**
     * 생성자 (모든 의존성 주입).
     *
     * @param config 설정
     * @param sleeper 백오프 대기 수단
     * @param clock 시각 공급자
     * @param backoffCalculator 백오프 계산기
     * @param attemptExecutor 제한 시간이 있는 시도를 실행할 ExecutorService
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultResilienceOrchestrator(
        ResilienceConfig config,
        Sleeper sleeper,
        Clock clock,
        BackoffCalculator backoffCalculator,
        ExecutorService attemptExecutor
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (attemptExecutor == null) {
            throw new IllegalArgumentException("attemptExecutor cannot be null");
        }
        this.config = config;
        this.circuitBreakers = new CircuitBreakerRegistry(config.circuitBreaker(), clock);
        this.bulkheads = new BulkheadRegistry(config.bulkhead());
        this.metrics = new ResilienceMetrics();
        this.retryManager = new RetryManager(backoffCalculator, sleeper, clock, metrics);
        this.attemptExecutor = attemptExecutor;
    }

    @Override
    public <T> ResilienceResult<T> execute(Operation<T> operation, String operationName, Fallback<T> fallback) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        String name = OperationName.of(operationName).getValue();
        Fallback<T> effectiveFallback = config.fallbackEnabled() ? fallback : null;

        // 1. Bulkhead (대기 없음)
        Bulkhead bulkhead = config.bulkheadEnabled() ? bulkheads.get(name) : NO_OP_BULKHEAD;
        if (!bulkhead.tryAcquire()) {
            log.warn("Bulkhead full for '{}' (maxConcurrentCalls={})", name, bulkhead.getConfig().maxConcurrentCalls());
            BulkheadFullException rejected =
                new BulkheadFullException(name, bulkhead.getConfig().maxConcurrentCalls());
            if (effectiveFallback == null) {
                metrics.recordCall(new CallOutcome(false, false, false, 0, true));
                throw rejected;
            }
            return runFallback(effectiveFallback, name, 0, rejected, false, 0, true);
        }

        try {
            // 2. 재시도 루프, 매 시도는 Circuit Breaker + 제한 시간
            CircuitBreaker breaker = breakerFor(name);
            AtomicInteger timeouts = new AtomicInteger();
            AtomicInteger attempts = new AtomicInteger();
            RetryResult<T> result;
            try {
                result = retryManager.execute("", "", name,
                    () -> {
                        attempts.incrementAndGet();
                        return breaker.call(() -> runAttempt(operation, name, timeouts));
                    },
                    config.effectiveRetryPolicy());
            } catch (WaypointException interrupted) {
                // 백오프 대기 중 인터럽트 (인터럽트 플래그는 복원된 상태)
                return interruptedCall(interrupted, name, attempts.get(), timeouts.get(), effectiveFallback);
            }

            if (result.success()) {
                metrics.recordCall(new CallOutcome(true, false, false, timeouts.get(), false));
                return ResilienceResult.of(result.result(), result.attempts());
            }

            // 3. 최종 실패
            Throwable cause = result.lastError();
            boolean circuitOpen = cause instanceof CircuitOpenException;
            if (effectiveFallback != null) {
                return runFallback(effectiveFallback, name, result.attempts(), cause, circuitOpen, timeouts.get(), false);
            }
            metrics.recordCall(new CallOutcome(false, false, circuitOpen, timeouts.get(), false));
            if (circuitOpen) {
                throw (CircuitOpenException) cause;
            }
            log.error("Resilient execution of '{}' failed after {} attempt(s)", name, result.attempts(), cause);
            throw new ResilienceException(name, result.attempts(), cause);
        } finally {
            // 4. 모든 종료 경로에서 반환
            bulkhead.release();
        }
    }

    private <T> ResilienceResult<T> interruptedCall(WaypointException interrupted, String name, int attempts,
                                                    int timeouts, Fallback<T> fallback) {
        if (fallback != null) {
            return runFallback(fallback, name, attempts, interrupted, false, timeouts, false);
        }
        metrics.recordCall(new CallOutcome(false, false, false, timeouts, false));
        log.warn("Resilient execution of '{}' interrupted after {} attempt(s)", name, attempts);
        throw new ResilienceException(name, attempts, interrupted);
    }

    private CircuitBreaker breakerFor(String name) {
        return config.circuitBreakerEnabled() ? circuitBreakers.get(name) : new NoOpCircuitBreaker(name);
    }

    /**
     * 제한 시간 안에서 한 번 실행.
     *
     * <p>제한 시간이 없으면 호출 스레드에서 그대로 실행합니다.</p>
     */
    private <T> T runAttempt(Operation<T> operation, String name, AtomicInteger timeouts) throws Exception {
        if (!config.hasTimeout()) {
            return operation.execute();
        }

        CompletableFuture<T> outcome = new CompletableFuture<>();
        attemptExecutor.execute(() -> {
            try {
                outcome.complete(operation.execute());
            } catch (Throwable t) {
                outcome.completeExceptionally(t);
            }
        });

        try {
            return outcome.get(config.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            timeouts.incrementAndGet();
            log.warn("Attempt of '{}' timed out after {}ms", name, config.timeout().toMillis());
            throw new OperationTimeoutException(name, config.timeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new WaypointException("Attempt of '" + name + "' failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WaypointException("Attempt of '" + name + "' interrupted", e);
        }
    }

    private <T> ResilienceResult<T> runFallback(Fallback<T> fallback, String name, int attempts, Throwable cause,
                                                boolean circuitOpen, int timeouts, boolean bulkheadRejected) {
        try {
            T value = fallback.apply(cause);
            log.warn("Fallback used for '{}' after {} attempt(s): {}", name, attempts, cause.toString());
            metrics.recordCall(new CallOutcome(false, true, circuitOpen, timeouts, bulkheadRejected));
            return ResilienceResult.fromFallback(value, attempts, cause);
        } catch (Exception fallbackError) {
            log.error("Fallback for '{}' failed", name, fallbackError);
            metrics.recordCall(new CallOutcome(false, false, circuitOpen, timeouts, bulkheadRejected));
            throw ResilienceException.withFallbackFailure(name, attempts, cause, fallbackError);
        }
    }

    @Override
    public CircuitBreakerState getCircuitState(String operationName) {
        return circuitBreakers.find(operationName)
            .map(CircuitBreaker::getState)
            .orElse(CircuitBreakerState.CLOSED);
    }

    @Override
    public Optional<CircuitBreakerSnapshot> getCircuitSnapshot(String operationName) {
        return circuitBreakers.find(operationName).map(CircuitBreaker::snapshot);
    }

    @Override
    public void resetCircuit(String operationName) {
        circuitBreakers.reset(operationName);
    }

    @Override
    public ResilienceMetricsSnapshot getMetrics() {
        return metrics.snapshot(circuitBreakers.snapshots());
    }

    @Override
    public void resetMetrics() {
        metrics.reset();
    }

    public RetryManager getRetryManager() {
        return retryManager;
    }

    public ResilienceConfig getConfig() {
        return config;
    }

    /**
     * 시도 실행 스레드 정리.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        attemptExecutor.shutdown();
        if (!attemptExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
            attemptExecutor.shutdownNow();
        }
    }

    private static ThreadFactory attemptThreadFactory() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "waypoint-attempt-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

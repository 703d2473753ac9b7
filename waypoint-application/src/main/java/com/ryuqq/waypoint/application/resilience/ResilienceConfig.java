package com.ryuqq.waypoint.application.resilience;

import com.ryuqq.waypoint.core.protection.BulkheadConfig;
import com.ryuqq.waypoint.core.protection.CircuitBreakerConfig;
import com.ryuqq.waypoint.core.retry.RetryPolicy;

import java.time.Duration;

/**
 * ResilienceOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>circuitBreakerEnabled: Circuit Breaker 사용 여부 (기본 true)</li>
 *   <li>circuitBreaker: 실패 5회, 복구 대기 60초, 성공 2회</li>
 *   <li>retryEnabled: 재시도 사용 여부 (기본 true, false이면 1회만 시도)</li>
 *   <li>retryPolicy: 지수 백오프 3회, 100ms ~ 10초</li>
 *   <li>fallbackEnabled: fallback 사용 여부 (기본 true)</li>
 *   <li>timeout: 시도별 제한 시간 (기본 30초, {@link Duration#ZERO}이면 제한 없음)</li>
 *   <li>bulkheadEnabled: Bulkhead 사용 여부 (기본 false)</li>
 *   <li>bulkhead: 최대 동시 실행 100</li>
 * </ul>
 *
 * <p>꺼진 Circuit Breaker와 Bulkhead는 NoOp 구현으로 대체됩니다.</p>
 *
 * @param circuitBreakerEnabled Circuit Breaker 사용 여부
 * @param circuitBreaker Circuit Breaker 설정
 * @param retryEnabled 재시도 사용 여부
 * @param retryPolicy 재시도 정책
 * @param fallbackEnabled fallback 사용 여부
 * @param timeout 시도별 제한 시간 (음수 불가)
 * @param bulkheadEnabled Bulkhead 사용 여부
 * @param bulkhead Bulkhead 설정
 * @author Waypoint Team
 * @since 1.0.0
 */
public record ResilienceConfig(
    boolean circuitBreakerEnabled,
    CircuitBreakerConfig circuitBreaker,
    boolean retryEnabled,
    RetryPolicy retryPolicy,
    boolean fallbackEnabled,
    Duration timeout,
    boolean bulkheadEnabled,
    BulkheadConfig bulkhead
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ResilienceConfig {
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative (current: " + timeout + ")");
        }
        if (bulkhead == null) {
            throw new IllegalArgumentException("bulkhead cannot be null");
        }
    }

    /**
     * 기본 설정 생성자.
     */
    public ResilienceConfig() {
        this(true, new CircuitBreakerConfig(), true, RetryPolicy.defaults(), true,
            DEFAULT_TIMEOUT, false, new BulkheadConfig());
    }

    /**
     * 시도별 제한 시간 사용 여부.
     *
     * @return timeout이 0보다 크면 true
     */
    public boolean hasTimeout() {
        return !timeout.isZero();
    }

    /**
     * 실제로 적용되는 재시도 정책.
     *
     * @return 재시도가 꺼져 있으면 1회 시도 정책
     */
    public RetryPolicy effectiveRetryPolicy() {
        return retryEnabled ? retryPolicy : retryPolicy.withMaxAttempts(1);
    }

    public ResilienceConfig withCircuitBreakerEnabled(boolean circuitBreakerEnabled) {
        return new ResilienceConfig(circuitBreakerEnabled, circuitBreaker, retryEnabled, retryPolicy,
            fallbackEnabled, timeout, bulkheadEnabled, bulkhead);
    }

    public ResilienceConfig withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new ResilienceConfig(circuitBreakerEnabled, circuitBreaker, retryEnabled, retryPolicy,
            fallbackEnabled, timeout, bulkheadEnabled, bulkhead);
    }

    public ResilienceConfig withRetryEnabled(boolean retryEnabled) {
        return new ResilienceConfig(circuitBreakerEnabled, circuitBreaker, retryEnabled, retryPolicy,
            fallbackEnabled, timeout, bulkheadEnabled, bulkhead);
    }

    public ResilienceConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new ResilienceConfig(circuitBreakerEnabled, circuitBreaker, retryEnabled, retryPolicy,
            fallbackEnabled, timeout, bulkheadEnabled, bulkhead);
    }

    public ResilienceConfig withFallbackEnabled(boolean fallbackEnabled) {
        return new ResilienceConfig(circuitBreakerEnabled, circuitBreaker, retryEnabled, retryPolicy,
            fallbackEnabled, timeout, bulkheadEnabled, bulkhead);
    }

    public ResilienceConfig withTimeout(Duration timeout) {
        return new ResilienceConfig(circuitBreakerEnabled, circuitBreaker, retryEnabled, retryPolicy,
            fallbackEnabled, timeout, bulkheadEnabled, bulkhead);
    }

    public ResilienceConfig withBulkheadEnabled(boolean bulkheadEnabled) {
        return new ResilienceConfig(circuitBreakerEnabled, circuitBreaker, retryEnabled, retryPolicy,
            fallbackEnabled, timeout, bulkheadEnabled, bulkhead);
    }

    public ResilienceConfig withBulkhead(BulkheadConfig bulkhead) {
        return new ResilienceConfig(circuitBreakerEnabled, circuitBreaker, retryEnabled, retryPolicy,
            fallbackEnabled, timeout, bulkheadEnabled, bulkhead);
    }
}

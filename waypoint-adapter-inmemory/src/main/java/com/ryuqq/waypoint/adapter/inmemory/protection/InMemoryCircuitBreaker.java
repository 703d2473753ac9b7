package com.ryuqq.waypoint.adapter.inmemory.protection;

import com.ryuqq.waypoint.core.protection.CircuitBreaker;
import com.ryuqq.waypoint.core.protection.CircuitBreakerConfig;
import com.ryuqq.waypoint.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.waypoint.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Operation 이름별 Circuit Breaker 구현.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED ──(연속 실패 ≥ failureThreshold)──→ OPEN
 * OPEN ──(recoveryTimeout 경과 후 조회)──→ HALF_OPEN
 * HALF_OPEN ──(연속 성공 ≥ successThreshold)──→ CLOSED (카운터 리셋)
 * HALF_OPEN ──(실패 1회)──→ OPEN (openedAt 갱신)
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>모든 상태 변경은 breaker별 {@link ReentrantLock}으로 직렬화</li>
 *   <li>Operation 실행은 lock 밖에서 수행 ({@link CircuitBreaker#call} 참고)</li>
 *   <li>HALF_OPEN에서 동시 probe 수는 제한하지 않음</li>
 * </ul>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class InMemoryCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant openedAt;
    private Instant lastFailureTime;
    private long totalCalls;
    private long totalSuccesses;
    private long totalFailures;
    private long totalRejected;

    /**
     * 생성자.
     *
     * @param name Operation 이름
     * @param config 설정
     * @param clock 시각 공급자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public InMemoryCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    public InMemoryCircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    @Override
    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            if (currentState() == CircuitBreakerState.OPEN) {
                totalRejected++;
                log.debug("Circuit '{}' rejected call, retry after {}", name, retryAfter());
                return false;
            }
            totalCalls++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess() {
        lock.lock();
        try {
            totalSuccesses++;
            switch (currentState()) {
                case CLOSED -> failureCount = 0;
                case HALF_OPEN -> {
                    successCount++;
                    if (successCount >= config.successThreshold()) {
                        close();
                    }
                }
                case OPEN -> {
                    // 거부 이전에 시작된 호출의 늦은 성공
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(Throwable throwable) {
        lock.lock();
        try {
            totalFailures++;
            lastFailureTime = clock.instant();
            switch (currentState()) {
                case CLOSED -> {
                    failureCount++;
                    if (failureCount >= config.failureThreshold()) {
                        open(throwable);
                    }
                }
                case HALF_OPEN -> open(throwable);
                case OPEN -> {
                    // 이미 OPEN
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return currentState();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Duration getRetryAfter() {
        lock.lock();
        try {
            return retryAfter();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(
                name, currentState(), failureCount, successCount, openedAt, lastFailureTime,
                totalCalls, totalSuccesses, totalFailures, totalRejected
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            state = CircuitBreakerState.CLOSED;
            failureCount = 0;
            successCount = 0;
            openedAt = null;
            lastFailureTime = null;
            totalCalls = 0;
            totalSuccesses = 0;
            totalFailures = 0;
            totalRejected = 0;
            log.info("Circuit '{}' reset to CLOSED", name);
        } finally {
            lock.unlock();
        }
    }

    // lock 보유 상태에서만 호출
    private CircuitBreakerState currentState() {
        if (state == CircuitBreakerState.OPEN
            && !clock.instant().isBefore(openedAt.plus(config.recoveryTimeout()))) {
            state = CircuitBreakerState.HALF_OPEN;
            successCount = 0;
            log.info("Circuit '{}' OPEN → HALF_OPEN after {}", name, config.recoveryTimeout());
        }
        return state;
    }

    private Duration retryAfter() {
        if (currentState() != CircuitBreakerState.OPEN) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), openedAt.plus(config.recoveryTimeout()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private void open(Throwable cause) {
        CircuitBreakerState previous = state;
        state = CircuitBreakerState.OPEN;
        openedAt = clock.instant();
        successCount = 0;
        log.warn("Circuit '{}' {} → OPEN (failures={}, cause={})",
            name, previous, failureCount, cause == null ? null : cause.toString());
    }

    private void close() {
        state = CircuitBreakerState.CLOSED;
        failureCount = 0;
        successCount = 0;
        openedAt = null;
        log.info("Circuit '{}' HALF_OPEN → CLOSED", name);
    }
}

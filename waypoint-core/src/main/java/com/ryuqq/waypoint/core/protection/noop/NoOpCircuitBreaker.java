package com.ryuqq.waypoint.core.protection.noop;

import com.ryuqq.waypoint.core.protection.CircuitBreaker;
import com.ryuqq.waypoint.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.waypoint.core.protection.CircuitBreakerState;

import java.time.Duration;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * Circuit Breaker 기능이 꺼진 설정에서 사용됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>tryAcquire(): 항상 true 반환</li>
 *   <li>recordSuccess(), recordFailure(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>reset(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String name;

    public NoOpCircuitBreaker(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public void recordSuccess() {
        // NoOp
    }

    @Override
    public void recordFailure(Throwable throwable) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public Duration getRetryAfter() {
        return Duration.ZERO;
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(name, CircuitBreakerState.CLOSED, 0, 0, null, null, 0, 0, 0, 0);
    }

    @Override
    public void reset() {
        // NoOp
    }
}

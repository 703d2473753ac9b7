package com.ryuqq.waypoint.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>failureThreshold: 5</li>
 *   <li>recoveryTimeout: 60초</li>
 *   <li>successThreshold: 2</li>
 * </ul>
 *
 * @param failureThreshold OPEN으로 전이하는 연속 실패 횟수
 * @param recoveryTimeout OPEN 유지 시간
 * @param successThreshold HALF_OPEN에서 CLOSED로 복귀하는 연속 성공 횟수
 * @author Waypoint Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration recoveryTimeout,
    int successThreshold
) {

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (recoveryTimeout == null) {
            throw new IllegalArgumentException("recoveryTimeout cannot be null");
        }
        if (recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "recoveryTimeout cannot be negative (current: " + recoveryTimeout + ")"
            );
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException(
                "successThreshold must be positive (current: " + successThreshold + ")"
            );
        }
    }

    /**
     * 기본 설정으로 생성.
     */
    public CircuitBreakerConfig() {
        this(5, Duration.ofSeconds(60), 2);
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold);
    }

    public CircuitBreakerConfig withRecoveryTimeout(Duration recoveryTimeout) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold);
    }

    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold);
    }
}

package com.ryuqq.waypoint.core.exception;

import java.time.Duration;

/**
 * Circuit Breaker가 OPEN 상태여서 Operation을 호출하지 않고 거부했을 때 발생합니다.
 *
 * <p>실제 Operation 실패와 구분하여 집계되며, 재시도 대상이 아닙니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class CircuitOpenException extends WaypointException {

    private final String operationName;
    private final Duration retryAfter;

    /**
     * @param operationName 차단된 Operation 이름
     * @param retryAfter HALF_OPEN 전환까지 남은 시간
     */
    public CircuitOpenException(String operationName, Duration retryAfter) {
        super("Circuit breaker is OPEN for '" + operationName + "' (retry after " + retryAfter.toMillis() + "ms)");
        this.operationName = operationName;
        this.retryAfter = retryAfter;
    }

    public String getOperationName() {
        return operationName;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}

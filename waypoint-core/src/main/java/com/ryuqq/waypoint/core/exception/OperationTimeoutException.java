package com.ryuqq.waypoint.core.exception;

import java.time.Duration;

/**
 * 단일 시도가 제한 시간을 넘겼을 때 발생합니다.
 *
 * <p>재시도 가능한 TIMEOUT 실패로 분류됩니다. 진행 중이던 작업은 강제로 중단되지 않습니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class OperationTimeoutException extends WaypointException {

    private final String operationName;
    private final Duration timeout;

    public OperationTimeoutException(String operationName, Duration timeout) {
        super("Operation '" + operationName + "' timed out after " + timeout.toMillis() + "ms");
        this.operationName = operationName;
        this.timeout = timeout;
    }

    public String getOperationName() {
        return operationName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}

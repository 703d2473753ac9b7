package com.ryuqq.waypoint.core.exception;

/**
 * Bulkhead 허용량이 모두 사용 중이어서 호출이 즉시 거부되었을 때 발생합니다.
 *
 * <p>대기열은 없습니다. 포화 상태는 대기가 아니라 즉시 결과입니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class BulkheadFullException extends WaypointException {

    private final String operationName;
    private final int maxConcurrentCalls;

    public BulkheadFullException(String operationName, int maxConcurrentCalls) {
        super("Bulkhead is full for '" + operationName + "' (maxConcurrentCalls: " + maxConcurrentCalls + ")");
        this.operationName = operationName;
        this.maxConcurrentCalls = maxConcurrentCalls;
    }

    public String getOperationName() {
        return operationName;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }
}

package com.ryuqq.waypoint.core.protection;

/**
 * Bulkhead 설정.
 *
 * <p>대기 시간 설정은 없습니다. 허용량이 없으면 즉시 거부됩니다.</p>
 *
 * @param maxConcurrentCalls Operation 이름별 최대 동시 실행 수 (기본값 100)
 * @author Waypoint Team
 * @since 1.0.0
 */
public record BulkheadConfig(int maxConcurrentCalls) {

    public BulkheadConfig {
        if (maxConcurrentCalls <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentCalls must be positive (current: " + maxConcurrentCalls + ")"
            );
        }
    }

    public BulkheadConfig() {
        this(100);
    }
}

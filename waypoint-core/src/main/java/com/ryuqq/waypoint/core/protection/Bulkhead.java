package com.ryuqq.waypoint.core.protection;

/**
 * Bulkhead SPI.
 *
 * <p>Operation 이름별 동시 실행 수를 제한합니다. 허용량 확보는 한 번만 시도하며
 * 절대 대기하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!bulkhead.tryAcquire()) {
 *     throw new BulkheadFullException(name, bulkhead.getConfig().maxConcurrentCalls());
 * }
 * try {
 *     return operation.execute();
 * } finally {
 *     bulkhead.release();
 * }
 * }</pre>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public interface Bulkhead {

    /**
     * 허용량 즉시 확보 시도.
     *
     * @return true: 확보 성공, false: 포화 상태
     */
    boolean tryAcquire();

    /**
     * 확보한 허용량 반환. 모든 종료 경로에서 호출되어야 합니다.
     */
    void release();

    /**
     * 현재 사용 중인 허용량.
     *
     * @return 현재 동시 실행 수
     */
    int getCurrentConcurrency();

    /**
     * 포화로 거부된 누적 횟수.
     *
     * @return 거부 횟수
     */
    long getRejectedCount();

    BulkheadConfig getConfig();
}

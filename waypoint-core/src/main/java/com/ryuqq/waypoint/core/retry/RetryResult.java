package com.ryuqq.waypoint.core.retry;

import java.time.Duration;

/**
 * 재시도 실행 결과. 실행마다 한 번 생성되며 변경되지 않습니다.
 *
 * @param success 성공 여부
 * @param result 성공 시 결과 (실패 시 null)
 * @param lastError 실패 시 마지막 예외 (성공 시 null)
 * @param attempts 실제 시도 횟수
 * @param totalDelay backoff로 대기한 총 시간
 * @param <T> 결과 타입
 * @author Waypoint Team
 * @since 1.0.0
 */
public record RetryResult<T>(
    boolean success,
    T result,
    Throwable lastError,
    int attempts,
    Duration totalDelay
) {

    public RetryResult {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts cannot be negative (current: " + attempts + ")");
        }
        if (totalDelay == null) {
            throw new IllegalArgumentException("totalDelay cannot be null");
        }
        if (!success && lastError == null) {
            throw new IllegalArgumentException("lastError cannot be null for a failed result");
        }
    }

    public static <T> RetryResult<T> succeeded(T result, int attempts, Duration totalDelay) {
        return new RetryResult<>(true, result, null, attempts, totalDelay);
    }

    public static <T> RetryResult<T> failed(Throwable lastError, int attempts, Duration totalDelay) {
        return new RetryResult<>(false, null, lastError, attempts, totalDelay);
    }

    /**
     * 재시도 횟수 (최초 시도 제외).
     *
     * @return max(0, attempts - 1)
     */
    public int retries() {
        return Math.max(0, attempts - 1);
    }
}

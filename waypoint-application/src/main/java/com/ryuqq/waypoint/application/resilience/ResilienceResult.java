package com.ryuqq.waypoint.application.resilience;

/**
 * 보호 실행 결과.
 *
 * @param result Operation 또는 fallback 결과
 * @param usedFallback fallback 결과 여부
 * @param attempts Operation 시도 횟수 (Bulkhead 거부 시 0)
 * @param fallbackCause fallback을 실행하게 만든 실패 (fallback을 쓰지 않았으면 null)
 * @param <T> 결과 타입
 * @author Waypoint Team
 * @since 1.0.0
 */
public record ResilienceResult<T>(
    T result,
    boolean usedFallback,
    int attempts,
    Throwable fallbackCause
) {

    public static <T> ResilienceResult<T> of(T result, int attempts) {
        return new ResilienceResult<>(result, false, attempts, null);
    }

    public static <T> ResilienceResult<T> fromFallback(T result, int attempts, Throwable cause) {
        return new ResilienceResult<>(result, true, attempts, cause);
    }
}

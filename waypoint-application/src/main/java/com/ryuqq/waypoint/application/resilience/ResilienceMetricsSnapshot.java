package com.ryuqq.waypoint.application.resilience;

import com.ryuqq.waypoint.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.waypoint.core.retry.ErrorCategory;

import java.time.Duration;
import java.util.Map;

/**
 * 보호 실행 메트릭 스냅샷.
 *
 * <p>외부 호출 단위로 집계됩니다. 한 번의 {@code execute}는 재시도 횟수와 무관하게
 * totalCalls를 1 증가시킵니다.</p>
 *
 * @param totalCalls 전체 호출 수
 * @param successfulCalls Operation이 성공한 호출 수
 * @param failedCalls Operation이 최종 실패한 호출 수 (fallback 사용 여부 무관, Circuit OPEN 거부 제외)
 * @param retriedCalls 재시도가 한 번 이상 발생한 호출 수
 * @param fallbackCalls fallback 결과를 반환한 호출 수
 * @param circuitOpenCount Circuit OPEN 거부로 끝난 호출 수
 * @param timeoutCount 제한 시간을 넘긴 시도 수
 * @param bulkheadRejectedCount Bulkhead 포화로 거부된 호출 수
 * @param immediateSuccesses 첫 시도에 성공한 호출 수
 * @param successesAfterRetry 재시도 후 성공한 호출 수
 * @param totalAttempts 전체 시도 수
 * @param totalDelay backoff 대기 총합
 * @param averageDelay backoff 1회 평균
 * @param maxDelay backoff 1회 최대
 * @param errorCategories 최종 실패 시도의 분류별 건수
 * @param circuits Operation 이름별 Circuit Breaker 스냅샷
 * @author Waypoint Team
 * @since 1.0.0
 */
public record ResilienceMetricsSnapshot(
    long totalCalls,
    long successfulCalls,
    long failedCalls,
    long retriedCalls,
    long fallbackCalls,
    long circuitOpenCount,
    long timeoutCount,
    long bulkheadRejectedCount,
    long immediateSuccesses,
    long successesAfterRetry,
    long totalAttempts,
    Duration totalDelay,
    Duration averageDelay,
    Duration maxDelay,
    Map<ErrorCategory, Long> errorCategories,
    Map<String, CircuitBreakerSnapshot> circuits
) {

    public ResilienceMetricsSnapshot {
        errorCategories = Map.copyOf(errorCategories);
        circuits = Map.copyOf(circuits);
    }

    /**
     * 성공률.
     *
     * @return successfulCalls / totalCalls (호출이 없으면 0.0)
     */
    public double successRate() {
        return totalCalls == 0 ? 0.0 : (double) successfulCalls / totalCalls;
    }
}

package com.ryuqq.waypoint.adapter.runner;

import com.ryuqq.waypoint.application.resilience.ResilienceMetricsSnapshot;
import com.ryuqq.waypoint.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.waypoint.core.retry.ErrorCategory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrator 인스턴스가 소유하는 메트릭 집계기.
 *
 * <p>모든 갱신과 스냅샷은 하나의 lock(this)으로 직렬화됩니다.</p>
 *
 * <ul>
 *   <li>{@link #recordRetry}: 재시도 루프 1회당 한 번 (시도 수, 지연, 성공 유형, 실패 분류)</li>
 *   <li>{@link #recordCall}: 외부 호출 1회당 한 번 (성공/실패, fallback, Circuit OPEN, timeout, Bulkhead 거부)</li>
 * </ul>
 *
 * <p>Circuit OPEN으로 끝난 호출은 {@code circuitOpenCount}에만 집계되고
 * {@code failedCalls}와 실패 분류에는 포함되지 않습니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class ResilienceMetrics {

    /**
     * 외부 호출 1회의 결과.
     *
     * @param succeeded Operation이 결과를 반환했는지
     * @param usedFallback fallback 결과로 응답했는지
     * @param circuitOpen Circuit OPEN으로 끝났는지
     * @param timeouts 시도별 제한 시간 초과 횟수
     * @param bulkheadRejected Bulkhead에서 거부되었는지
     */
    public record CallOutcome(
        boolean succeeded,
        boolean usedFallback,
        boolean circuitOpen,
        int timeouts,
        boolean bulkheadRejected
    ) {
    }

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long retriedCalls;
    private long fallbackCalls;
    private long circuitOpenCount;
    private long timeoutCount;
    private long bulkheadRejectedCount;

    private long immediateSuccesses;
    private long successesAfterRetry;
    private long totalAttempts;
    private long delayCount;
    private Duration totalDelay = Duration.ZERO;
    private Duration maxDelay = Duration.ZERO;
    private final Map<ErrorCategory, Long> errorCategories = new EnumMap<>(ErrorCategory.class);

    /**
     * 재시도 루프 결과 기록.
     *
     * @param attempts 수행한 시도 수
     * @param delays 시도 사이에 적용한 지연 목록
     * @param succeeded 최종 성공 여부
     * @param failureCategory 최종 실패 분류 (성공이면 null)
     */
    public synchronized void recordRetry(int attempts, List<Duration> delays, boolean succeeded,
                                         ErrorCategory failureCategory) {
        totalAttempts += attempts;
        if (attempts > 1) {
            retriedCalls++;
        }
        if (succeeded) {
            if (attempts > 1) {
                successesAfterRetry++;
            } else {
                immediateSuccesses++;
            }
        } else if (failureCategory != null) {
            errorCategories.merge(failureCategory, 1L, Long::sum);
        }
        for (Duration delay : delays) {
            delayCount++;
            totalDelay = totalDelay.plus(delay);
            if (delay.compareTo(maxDelay) > 0) {
                maxDelay = delay;
            }
        }
    }

    /**
     * 외부 호출 결과 기록.
     *
     * @param outcome 호출 결과
     */
    public synchronized void recordCall(CallOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        totalCalls++;
        if (outcome.succeeded()) {
            successfulCalls++;
        } else if (!outcome.circuitOpen()) {
            failedCalls++;
        }
        if (outcome.usedFallback()) {
            fallbackCalls++;
        }
        if (outcome.circuitOpen()) {
            circuitOpenCount++;
        }
        if (outcome.bulkheadRejected()) {
            bulkheadRejectedCount++;
        }
        timeoutCount += outcome.timeouts();
    }

    /**
     * 현재 값 스냅샷.
     *
     * @param circuits Operation 이름별 Circuit Breaker 스냅샷
     * @return 스냅샷
     */
    public synchronized ResilienceMetricsSnapshot snapshot(Map<String, CircuitBreakerSnapshot> circuits) {
        Duration averageDelay = delayCount == 0 ? Duration.ZERO : totalDelay.dividedBy(delayCount);
        return new ResilienceMetricsSnapshot(
            totalCalls, successfulCalls, failedCalls, retriedCalls, fallbackCalls,
            circuitOpenCount, timeoutCount, bulkheadRejectedCount,
            immediateSuccesses, successesAfterRetry, totalAttempts,
            totalDelay, averageDelay, maxDelay,
            errorCategories, circuits == null ? Map.of() : circuits
        );
    }

    public synchronized void reset() {
        totalCalls = 0;
        successfulCalls = 0;
        failedCalls = 0;
        retriedCalls = 0;
        fallbackCalls = 0;
        circuitOpenCount = 0;
        timeoutCount = 0;
        bulkheadRejectedCount = 0;
        immediateSuccesses = 0;
        successesAfterRetry = 0;
        totalAttempts = 0;
        delayCount = 0;
        totalDelay = Duration.ZERO;
        maxDelay = Duration.ZERO;
        errorCategories.clear();
    }
}

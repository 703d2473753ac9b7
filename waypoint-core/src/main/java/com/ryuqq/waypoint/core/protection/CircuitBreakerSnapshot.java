package com.ryuqq.waypoint.core.protection;

import java.time.Instant;

/**
 * 특정 시점의 Circuit Breaker 상태와 누적 카운터.
 *
 * @param operationName Operation 이름
 * @param state 조회 시점의 상태 (recoveryTimeout 경과 시 HALF_OPEN)
 * @param failureCount 현재 연속 실패 횟수
 * @param successCount HALF_OPEN 연속 성공 횟수
 * @param openedAt 마지막 OPEN 전이 시각 (없으면 null)
 * @param lastFailureTime 마지막 실패 시각 (없으면 null)
 * @param totalCalls Operation을 실제 호출한 횟수
 * @param totalSuccesses 누적 성공 횟수
 * @param totalFailures 누적 실패 횟수
 * @param totalRejected OPEN으로 거부된 횟수
 * @author Waypoint Team
 * @since 1.0.0
 */
public record CircuitBreakerSnapshot(
    String operationName,
    CircuitBreakerState state,
    int failureCount,
    int successCount,
    Instant openedAt,
    Instant lastFailureTime,
    long totalCalls,
    long totalSuccesses,
    long totalFailures,
    long totalRejected
) {

    public double successRate() {
        return totalCalls == 0 ? 0.0 : (double) totalSuccesses / totalCalls;
    }

    public double failureRate() {
        return totalCalls == 0 ? 0.0 : (double) totalFailures / totalCalls;
    }

    /**
     * 거부율 (거부 / (호출 + 거부)).
     *
     * @return 0.0 ~ 1.0
     */
    public double rejectionRate() {
        long attempted = totalCalls + totalRejected;
        return attempted == 0 ? 0.0 : (double) totalRejected / attempted;
    }
}

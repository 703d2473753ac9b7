package com.ryuqq.waypoint.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 횟수 ≥ failureThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과 후 다음 상태 조회)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 연속 성공 successThreshold회 → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>실패는 failureCount를 증가시키고, 성공은 0으로 되돌립니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>recoveryTimeout이 지나기 전의 모든 호출은 Operation을 실행하지 않고 거부됩니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (복구 확인).
     *
     * <p>호출을 통과시키며, 성공이 successThreshold회 이어지면 CLOSED,
     * 한 번이라도 실패하면 즉시 OPEN으로 돌아갑니다.</p>
     */
    HALF_OPEN
}
